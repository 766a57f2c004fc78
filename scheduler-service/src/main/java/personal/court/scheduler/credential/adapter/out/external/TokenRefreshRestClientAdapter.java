package personal.court.scheduler.credential.adapter.out.external;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.credential.application.port.out.TokenRefreshClient;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;
import personal.court.scheduler.credential.domain.model.TokenGrant;

/**
 * Token Refresh REST Client Adapter
 * OAuth 토큰 엔드포인트 호출 (grant_type=refresh_token, form-urlencoded)
 *
 * - 400/401: 리프레시 토큰 거부 → CredentialExpiredException (운영자 조치 필요)
 * - 429, 5xx, 연결 실패: TransientExecutionException
 */
@Slf4j
@Component
public class TokenRefreshRestClientAdapter implements TokenRefreshClient {

    private final RestClient authRestClient;
    private final String tokenPath;
    private final String clientId;

    public TokenRefreshRestClientAdapter(RestClient authRestClient,
                                         @Value("${external.auth.token-path}") String tokenPath,
                                         @Value("${external.auth.client-id:my-tfc}") String clientId) {
        this.authRestClient = authRestClient;
        this.tokenPath = tokenPath;
        this.clientId = clientId;
    }

    @Override
    @CircuitBreaker(name = "authServer", fallbackMethod = "refreshFallback")
    public TokenGrant refresh(String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken.trim());
        form.add("client_id", clientId);

        TokenResponse response;
        try {
            response = authRestClient.post()
                    .uri(tokenPath)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.BAD_REQUEST.value()
                            || status.value() == HttpStatus.UNAUTHORIZED.value(), (req, res) -> {
                        log.error("Refresh token rejected by auth server: status={}", res.getStatusCode());
                        throw new CredentialExpiredException(
                                "Auth server rejected refresh token (" + res.getStatusCode().value() + ")");
                    })
                    .onStatus(status -> status.is5xxServerError() || status.is4xxClientError(), (req, res) -> {
                        log.warn("Auth server error: status={}", res.getStatusCode());
                        throw new TransientExecutionException("Auth server returned " + res.getStatusCode().value());
                    })
                    .body(TokenResponse.class);
        } catch (ResourceAccessException e) {
            log.warn("Auth server unreachable: error={}", e.getMessage());
            throw new TransientExecutionException("Auth server unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.accessToken() == null) {
            throw new TransientExecutionException("Auth server returned no access token");
        }
        log.debug("Token endpoint responded: expiresIn={}, refreshExpiresIn={}",
                response.expiresIn(), response.refreshExpiresIn());
        return response.toGrant();
    }

    /**
     * Circuit Open 또는 분류되지 않은 오류는 일시적 실패로 변환
     */
    private TokenGrant refreshFallback(String refreshToken, Exception e) {
        if (e instanceof CredentialExpiredException expired) {
            throw expired;
        }
        if (e instanceof TransientExecutionException transientFailure) {
            throw transientFailure;
        }
        log.error("Auth server circuit breaker opened: error={}", e.getClass().getSimpleName(), e);
        throw new TransientExecutionException("Auth server circuit open: " + e.getClass().getSimpleName());
    }
}
