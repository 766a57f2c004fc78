package personal.court.scheduler.credential.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.court.common.dto.ApiResponse;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;
import personal.court.scheduler.credential.adapter.in.web.dto.CredentialStatusResponse;
import personal.court.scheduler.credential.adapter.in.web.dto.RefreshTokenRequest;
import personal.court.scheduler.credential.application.port.in.GetCredentialHealthUseCase;
import personal.court.scheduler.credential.application.port.in.ManageCredentialUseCase;
import personal.court.scheduler.credential.domain.model.AlertLevel;
import personal.court.scheduler.credential.domain.model.CredentialHealth;

/**
 * Credential API Controller
 * 인증 상태 조회 및 리프레시 토큰 수동 교체
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/credentials")
@RequiredArgsConstructor
public class CredentialController {

    private final GetCredentialHealthUseCase getCredentialHealthUseCase;
    private final ManageCredentialUseCase manageCredentialUseCase;
    private final TriggerCalculator triggerCalculator;

    /**
     * GET /api/v1/credentials/status
     */
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<CredentialStatusResponse>> getStatus() {
        CredentialHealth health = getCredentialHealthUseCase.health();
        CredentialStatusResponse data = CredentialStatusResponse.from(health, triggerCalculator.courtZone());

        if (health.level() == AlertLevel.HEALTHY) {
            return ResponseEntity.ok(ApiResponse.success("Credentials are healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Credentials need attention", data));
    }

    /**
     * PUT /api/v1/credentials/refresh-token
     * 새 리프레시 토큰으로 즉시 갱신
     */
    @PutMapping("/refresh-token")
    public ResponseEntity<ApiResponse<CredentialStatusResponse>> rotateRefreshToken(
            @Valid @RequestBody RefreshTokenRequest request
    ) {
        log.info("Refresh token rotation requested");

        CredentialHealth health = manageCredentialUseCase.rotate(request.refreshToken());

        return ResponseEntity.ok(ApiResponse.success("Refresh token updated",
                CredentialStatusResponse.from(health, triggerCalculator.courtZone())));
    }
}
