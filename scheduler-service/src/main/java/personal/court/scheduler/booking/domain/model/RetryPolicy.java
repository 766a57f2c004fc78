package personal.court.scheduler.booking.domain.model;

import java.time.Duration;

/**
 * 일시적 실패 재시도 정책
 * 시도 횟수 상한 + 지수 backoff (baseDelay에서 시작해 multiplier배씩 증가, maxDelay로 제한)
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        double multiplier,
        Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be non-negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    /**
     * 첫 번째 시도 상태
     */
    public RetryState start() {
        return new RetryState(this, 1, baseDelay);
    }

    Duration grow(Duration delay) {
        long nextMillis = (long) Math.ceil(delay.toMillis() * multiplier);
        Duration next = Duration.ofMillis(nextMillis);
        return next.compareTo(maxDelay) > 0 ? maxDelay : next;
    }
}
