package personal.court.scheduler.credential.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.court.common.exception.BusinessException;
import personal.court.scheduler.credential.application.port.in.ManageCredentialUseCase;

/**
 * Credential Refresh Scheduler (Driving Adapter)
 * 액세스 토큰이 곧 만료되면 예약 실행 전에 미리 갱신
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialRefreshScheduler {

    private final ManageCredentialUseCase manageCredentialUseCase;

    /**
     * 주기: application.yml의 court.credential.refresh-interval-ms
     * 기본값: 20분
     */
    @Scheduled(
            initialDelayString = "${court.credential.refresh-initial-delay-ms:60000}",
            fixedDelayString = "${court.credential.refresh-interval-ms:1200000}")
    public void refreshProactively() {
        try {
            if (manageCredentialUseCase.refreshIfExpiringSoon()) {
                log.info("Proactive token refresh completed");
            }
        } catch (BusinessException e) {
            log.warn("Proactive token refresh failed: code={}, message={}",
                    e.getErrorCode().getCode(), e.getMessage());
        }
    }
}
