package personal.court.scheduler.credential.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * 리프레시 토큰 교체 요청 DTO
 */
public record RefreshTokenRequest(
        @NotBlank(message = "refresh_token is required")
        @JsonProperty("refresh_token") String refreshToken
) {
}
