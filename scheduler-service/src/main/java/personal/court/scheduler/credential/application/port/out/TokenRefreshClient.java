package personal.court.scheduler.credential.application.port.out;

import personal.court.scheduler.credential.domain.model.TokenGrant;

/**
 * Token Refresh Client (Output Port)
 * OAuth 토큰 엔드포인트 (grant_type=refresh_token)
 */
public interface TokenRefreshClient {

    /**
     * @throws personal.court.scheduler.credential.domain.exception.CredentialExpiredException   리프레시 토큰 거부 (400/401)
     * @throws personal.court.scheduler.booking.domain.exception.TransientExecutionException 네트워크 오류, 5xx
     */
    TokenGrant refresh(String refreshToken);
}
