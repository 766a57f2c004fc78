package personal.court.scheduler.credential.domain.model;

/**
 * 알림 수준 (심각도 오름차순)
 */
public enum AlertLevel {
    HEALTHY,
    WARNING,
    CRITICAL;

    public AlertLevel max(AlertLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
