package personal.court.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Court Scheduler 설정 Properties
 * application.yml의 court.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "court")
public record CourtSchedulerProperties(
        ZoneId zone,
        Scheduler scheduler,
        Execution execution,
        Credential credential,
        Bootstrap bootstrap
) {
    public record Scheduler(
            int workerThreads,
            Duration maxSleep  // 벽시계 재확인 주기 (프로세스 일시정지 보정)
    ) {}

    public record Execution(
            int maxAttempts,
            Duration baseDelay,
            Duration maxDelay,
            boolean fallbackToAlternateCourt
    ) {}

    public record Credential(
            Duration safetyMargin,
            Duration proactiveWindow,
            Duration acquireTimeout,
            Duration expiryWarning
    ) {}

    public record Bootstrap(
            boolean enabled,
            String schedulesPath,
            String tokensPath
    ) {}
}
