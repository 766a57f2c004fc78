package personal.court.scheduler.booking.application.port.out;

import java.time.Duration;

/**
 * 재시도 backoff 대기 (테스트에서는 가짜 구현으로 교체)
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
