package personal.court.scheduler.credential.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Credential Domain Model (단일 행)
 *
 * @param refreshExpiry 리프레시 토큰 만료 시각 (null이면 알 수 없음)
 */
public record Credential(
        Long id,
        String accessToken,
        Instant accessExpiry,
        String refreshToken,
        Instant refreshExpiry,
        String sessionState,
        Instant lastRefreshAt) {

    /**
     * 리프레시 토큰만 있는 초기 상태
     */
    public static Credential bootstrap(String refreshToken) {
        return new Credential(null, null, null, refreshToken, null, null, null);
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * now + margin 시점까지 유효한 액세스 토큰인지
     */
    public boolean isAccessValidFor(Instant now, Duration margin) {
        return hasAccessToken() && accessExpiry != null && accessExpiry.isAfter(now.plus(margin));
    }

    public boolean isRefreshExpired(Instant now) {
        return refreshExpiry != null && !refreshExpiry.isAfter(now);
    }

    /**
     * 토큰 갱신 결과 반영
     * 응답에 리프레시 토큰이 없으면 기존 토큰을 유지한다.
     */
    public Credential withGrant(TokenGrant grant, Instant now) {
        boolean rotated = grant.refreshToken() != null && !grant.refreshToken().isBlank();
        Instant newRefreshExpiry;
        if (grant.refreshExpiresIn() > 0) {
            newRefreshExpiry = now.plusSeconds(grant.refreshExpiresIn());
        } else {
            newRefreshExpiry = rotated ? null : refreshExpiry;
        }
        return new Credential(
                id,
                grant.accessToken(),
                now.plusSeconds(grant.expiresIn()),
                rotated ? grant.refreshToken() : refreshToken,
                newRefreshExpiry,
                grant.sessionState() != null ? grant.sessionState() : sessionState,
                now);
    }

    /**
     * 운영자가 새 리프레시 토큰을 등록 (기존 액세스 토큰은 폐기)
     */
    public Credential withRefreshToken(String newRefreshToken) {
        return new Credential(id, null, null, newRefreshToken, null, null, lastRefreshAt);
    }

    /**
     * 액세스 토큰만 폐기 (리프레시 토큰은 유지)
     */
    public Credential withoutAccessToken() {
        return new Credential(id, null, null, refreshToken, refreshExpiry, sessionState, lastRefreshAt);
    }
}
