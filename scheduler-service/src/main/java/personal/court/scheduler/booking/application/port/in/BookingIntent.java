package personal.court.scheduler.booking.application.port.in;

/**
 * Booking Intent
 * 사용자가 선언한 예약 의도 원문 (파일 또는 API로 들어온 값 그대로)
 * 해석과 검증은 적재 시점에 수행되며, 잘못된 의도는 해당 건만 거부된다.
 *
 * @param kind            "one-off" 또는 "recurring"
 * @param desiredTime     ISO-8601 시각 (offset이 없으면 코트 시간대 기준)
 * @param courtId         "1" 또는 "2" (없으면 "1")
 * @param durationMinutes 사용 시간 (없으면 60분)
 * @param recurrenceRule  반복 규칙 (recurring일 때 필수)
 */
public record BookingIntent(
        String kind,
        String desiredTime,
        String courtId,
        Integer durationMinutes,
        String recurrenceRule
) {
}
