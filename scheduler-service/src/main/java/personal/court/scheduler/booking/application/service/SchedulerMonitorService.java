package personal.court.scheduler.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.scheduler.booking.application.port.in.GetSchedulerAlertsUseCase;
import personal.court.scheduler.booking.application.port.in.GetSchedulerStatusUseCase;
import personal.court.scheduler.booking.application.port.in.SchedulerAlerts;
import personal.court.scheduler.booking.application.port.in.SchedulerAlerts.Alert;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort.SchedulerSnapshot;
import personal.court.scheduler.credential.application.port.in.GetCredentialHealthUseCase;
import personal.court.scheduler.credential.domain.model.AlertLevel;
import personal.court.scheduler.credential.domain.model.CredentialHealth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scheduler Monitor Service
 * 스케줄러 상태와 운영 알림 계산
 *
 * 알림 규칙:
 * - CRITICAL: 리프레시 토큰 없음/만료/거부, 예약 API의 액세스 토큰 거부(401), 스케줄러 정지
 * - WARNING: 리프레시 토큰 만료 임박, 액세스 토큰 만료
 * - 인증이 CRITICAL이면 7일 내 PENDING 작업 수를 함께 알림 (실행 시 실패 예정)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerMonitorService implements GetSchedulerStatusUseCase, GetSchedulerAlertsUseCase {

    private static final Duration UPCOMING_WINDOW = Duration.ofDays(7);
    private static final String AUTHENTICATION = "authentication";

    private final TriggerSchedulerPort triggerSchedulerPort;
    private final GetCredentialHealthUseCase getCredentialHealthUseCase;
    private final JobRepository jobRepository;
    private final Clock clock;

    @Override
    public SchedulerSnapshot getStatus() {
        return triggerSchedulerPort.snapshot();
    }

    @Override
    public SchedulerAlerts getAlerts() {
        List<Alert> alerts = new ArrayList<>();
        CredentialHealth health = getCredentialHealthUseCase.health();

        if (!health.hasRefreshToken()) {
            alerts.add(new Alert(AlertLevel.CRITICAL, AUTHENTICATION,
                    "No refresh token configured",
                    "Configure tokens.json or rotate the refresh token"));
        } else if (health.refreshTokenExpired()) {
            alerts.add(new Alert(AlertLevel.CRITICAL, AUTHENTICATION,
                    "Refresh token has expired",
                    "Manual token update needed"));
        } else if (health.refreshTokenRejected()) {
            alerts.add(new Alert(AlertLevel.CRITICAL, AUTHENTICATION,
                    "Refresh token rejected: " + health.lastRefreshError(),
                    "Manual token update needed"));
        } else if (health.refreshExpiresInDays() != null
                && health.refreshExpiresInDays() < UPCOMING_WINDOW.toDays()) {
            alerts.add(new Alert(AlertLevel.WARNING, AUTHENTICATION,
                    String.format(Locale.ROOT, "Refresh token expires in %.1f days", health.refreshExpiresInDays()),
                    "Plan token renewal"));
        }

        if (health.accessTokenRejection() != null) {
            alerts.add(new Alert(AlertLevel.CRITICAL, AUTHENTICATION,
                    "Booking API rejected access token: " + health.accessTokenRejection(),
                    "Check the account session; rotate the refresh token if the next booking is also rejected"));
        }

        if (health.hasAccessToken() && !health.accessTokenValid()) {
            alerts.add(new Alert(AlertLevel.WARNING, AUTHENTICATION,
                    "Access token has expired. Next booking may fail if token refresh also fails.",
                    "Monitor next booking attempt"));
        }

        boolean tokenCritical = alerts.stream().anyMatch(alert -> alert.level() == AlertLevel.CRITICAL);
        if (tokenCritical) {
            Instant now = clock.instant();
            int upcoming = jobRepository.findPendingDesiredBetween(now, now.plus(UPCOMING_WINDOW)).size();
            if (upcoming > 0) {
                alerts.add(new Alert(AlertLevel.CRITICAL, "bookings",
                        upcoming + " upcoming bookings will fail due to token issues",
                        "Fix authentication tokens immediately"));
            }
        }

        if (!triggerSchedulerPort.snapshot().running()) {
            alerts.add(new Alert(AlertLevel.CRITICAL, "scheduler",
                    "Scheduler is not running",
                    "Restart the scheduler service"));
        }

        AlertLevel level = alerts.stream()
                .map(Alert::level)
                .reduce(AlertLevel.HEALTHY, AlertLevel::max);
        if (level != AlertLevel.HEALTHY) {
            log.warn("Scheduler alerts raised: level={}, count={}", level, alerts.size());
        }
        return new SchedulerAlerts(level, List.copyOf(alerts));
    }
}
