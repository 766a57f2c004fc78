package personal.court.scheduler.credential.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * 인증 상태 요약 (모니터링용)
 *
 * @param accessTokenRejection 예약 API가 액세스 토큰을 거부한 사유 (정상 예약이 확인되면 null)
 * @param reasons level이 HEALTHY가 아닐 때의 사유
 */
public record CredentialHealth(
        AlertLevel level,
        boolean hasAccessToken,
        boolean accessTokenValid,
        Instant accessExpiry,
        Long accessExpiresInSeconds,
        boolean hasRefreshToken,
        boolean refreshTokenExpired,
        boolean refreshTokenRejected,
        Instant refreshExpiry,
        Double refreshExpiresInDays,
        Instant lastRefreshAt,
        Instant lastRefreshAttemptAt,
        String lastRefreshError,
        String accessTokenRejection,
        List<String> reasons
) {
}
