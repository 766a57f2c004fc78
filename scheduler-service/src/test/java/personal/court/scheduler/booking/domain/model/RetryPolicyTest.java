package personal.court.scheduler.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy 상태 머신 테스트")
class RetryPolicyTest {

    @Test
    @DisplayName("대기 시간은 지수적으로 늘어나고 시도 횟수 상한에서 멈춘다")
    void backoff_Exponential() {
        // given
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30));

        // when
        RetryState first = policy.start();
        RetryState second = first.next();
        RetryState third = second.next();

        // then
        assertThat(first.attempt()).isEqualTo(1);
        assertThat(first.nextDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(second.nextDelay()).isEqualTo(Duration.ofSeconds(4));
        assertThat(third.attempt()).isEqualTo(3);
        assertThat(third.hasNext()).isFalse();
        assertThatThrownBy(third::next).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("대기 시간은 maxDelay를 넘지 않는다")
    void backoff_Capped() {
        // given
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(20), 2.0, Duration.ofSeconds(30));

        // when
        RetryState state = policy.start().next().next();

        // then
        assertThat(state.nextDelay()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("시도 횟수가 1이면 재시도하지 않는다")
    void singleAttempt() {
        assertThat(new RetryPolicy(1, Duration.ZERO, 2.0, Duration.ZERO).start().hasNext()).isFalse();
    }

    @Test
    @DisplayName("잘못된 정책 값은 거부한다")
    void invalidPolicy() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
