package personal.court.scheduler.booking.domain.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Trigger Calculator
 * 희망 사용 시각으로부터 예약 제출 시각을 계산
 *
 * 예약 API는 사용 시각 기준 정확히 168시간 전부터 요청을 받는다.
 * 계산은 Instant 위에서 하므로 DST 전환과 무관하게 정확히 168시간 차이가 난다.
 * 코트 시간대는 표시용으로만 사용한다.
 */
public class TriggerCalculator {

    public static final Duration ADVANCE_WINDOW = Duration.ofHours(168);

    private static final DateTimeFormatter RENDER_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final ZoneId courtZone;

    public TriggerCalculator(ZoneId courtZone) {
        if (courtZone == null) {
            throw new IllegalArgumentException("Court zone cannot be null");
        }
        this.courtZone = courtZone;
    }

    public static Instant triggerFor(Instant desiredTime) {
        return desiredTime.minus(ADVANCE_WINDOW);
    }

    public ZoneId courtZone() {
        return courtZone;
    }

    public ZonedDateTime toCourtTime(Instant instant) {
        return instant.atZone(courtZone);
    }

    /**
     * 코트 시간대의 offset 포함 ISO 문자열 (예: 2026-03-10T19:00:00-04:00)
     */
    public String render(Instant instant) {
        return RENDER_FORMAT.format(toCourtTime(instant));
    }
}
