package personal.court.scheduler.credential.domain.model;

/**
 * 토큰 엔드포인트 응답
 *
 * @param expiresIn        액세스 토큰 유효 시간 (초)
 * @param refreshExpiresIn 리프레시 토큰 유효 시간 (초, 0이면 만료 없음)
 */
public record TokenGrant(
        String accessToken,
        String refreshToken,
        long expiresIn,
        long refreshExpiresIn,
        String sessionState
) {
    public TokenGrant {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Token grant without access token");
        }
    }
}
