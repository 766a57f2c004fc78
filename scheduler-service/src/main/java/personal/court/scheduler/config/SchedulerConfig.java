package personal.court.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import personal.court.scheduler.booking.application.port.out.Sleeper;
import personal.court.scheduler.booking.domain.model.RetryPolicy;
import personal.court.scheduler.booking.domain.service.RecurrenceExpander;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;

import java.time.Clock;

/**
 * 스케줄링 엔진 공용 빈 설정
 * Clock, 실행 워커 풀, 재시도 정책을 명시적으로 소유하고 각 컴포넌트에 주입
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TriggerCalculator triggerCalculator(CourtSchedulerProperties properties) {
        return new TriggerCalculator(properties.zone());
    }

    @Bean
    public RecurrenceExpander recurrenceExpander() {
        return new RecurrenceExpander();
    }

    @Bean
    public RetryPolicy retryPolicy(CourtSchedulerProperties properties) {
        CourtSchedulerProperties.Execution execution = properties.execution();
        return new RetryPolicy(
                execution.maxAttempts(),
                execution.baseDelay(),
                2.0,
                execution.maxDelay());
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    /**
     * 예약 실행 워커 풀
     * 네트워크 호출과 backoff 대기는 모두 이 풀에서 수행 (트리거 루프를 막지 않음)
     */
    @Bean
    public ThreadPoolTaskExecutor jobExecutor(CourtSchedulerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.scheduler().workerThreads());
        executor.setMaxPoolSize(properties.scheduler().workerThreads());
        executor.setThreadNamePrefix("job-exec-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
