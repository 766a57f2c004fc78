package personal.court.scheduler.booking.domain.model;

import java.time.Duration;

/**
 * 재시도 상태 머신의 현재 상태 (불변)
 *
 * @param policy    적용 정책
 * @param attempt   현재 시도 번호 (1부터)
 * @param nextDelay 다음 시도 전 대기 시간
 */
public record RetryState(RetryPolicy policy, int attempt, Duration nextDelay) {

    public boolean hasNext() {
        return attempt < policy.maxAttempts();
    }

    /**
     * 다음 시도 상태로 전이
     *
     * @throws IllegalStateException 시도 횟수를 모두 소진한 경우
     */
    public RetryState next() {
        if (!hasNext()) {
            throw new IllegalStateException(
                    String.format("Retry budget exhausted: attempt=%d, maxAttempts=%d", attempt, policy.maxAttempts()));
        }
        return new RetryState(policy, attempt + 1, policy.grow(nextDelay));
    }
}
