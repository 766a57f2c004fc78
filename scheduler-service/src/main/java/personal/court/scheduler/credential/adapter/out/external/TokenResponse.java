package personal.court.scheduler.credential.adapter.out.external;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import personal.court.scheduler.credential.domain.model.TokenGrant;

/**
 * OAuth 토큰 엔드포인트 응답
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_expires_in") long refreshExpiresIn,
        @JsonProperty("session_state") String sessionState
) {
    TokenGrant toGrant() {
        return new TokenGrant(accessToken, refreshToken, expiresIn, refreshExpiresIn, sessionState);
    }
}
