package personal.court.scheduler.booking.application.port.in;

import personal.court.scheduler.credential.domain.model.AlertLevel;

import java.util.List;

/**
 * 운영 알림 묶음
 *
 * @param level  가장 심각한 알림 수준
 * @param alerts 개별 알림
 */
public record SchedulerAlerts(
        AlertLevel level,
        List<Alert> alerts
) {
    public record Alert(
            AlertLevel level,
            String category,
            String message,
            String actionRequired
    ) {
    }
}
