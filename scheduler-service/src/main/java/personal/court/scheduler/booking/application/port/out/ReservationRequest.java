package personal.court.scheduler.booking.application.port.out;

import personal.court.scheduler.booking.domain.model.CourtId;

import java.time.ZonedDateTime;

/**
 * 코트 예약 요청 (코트 시간대 기준 시작/종료 시각)
 */
public record ReservationRequest(
        Long jobId,
        CourtId courtId,
        ZonedDateTime start,
        ZonedDateTime end
) {
}
