package personal.court.scheduler.booking.adapter.in.web.dto;

import personal.court.scheduler.booking.application.port.in.SchedulerAlerts;
import personal.court.scheduler.credential.domain.model.AlertLevel;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * 운영 알림 응답 DTO
 * CRITICAL은 alerts, WARNING은 warnings로 나눠서 반환
 */
public record SchedulerAlertsResponse(
        String status,
        int alertCount,
        int warningCount,
        List<AlertResponse> alerts,
        List<AlertResponse> warnings,
        OffsetDateTime lastCheck
) {
    public record AlertResponse(String type, String category, String message, String actionRequired) {
    }

    public static SchedulerAlertsResponse from(SchedulerAlerts alerts, OffsetDateTime checkedAt) {
        List<AlertResponse> critical = filter(alerts, AlertLevel.CRITICAL);
        List<AlertResponse> warnings = filter(alerts, AlertLevel.WARNING);
        return new SchedulerAlertsResponse(
                alerts.level().name().toLowerCase(Locale.ROOT),
                critical.size(),
                warnings.size(),
                critical,
                warnings,
                checkedAt
        );
    }

    private static List<AlertResponse> filter(SchedulerAlerts alerts, AlertLevel level) {
        return alerts.alerts().stream()
                .filter(alert -> alert.level() == level)
                .map(alert -> new AlertResponse(
                        level.name().toLowerCase(Locale.ROOT),
                        alert.category(),
                        alert.message(),
                        alert.actionRequired()))
                .toList();
    }
}
