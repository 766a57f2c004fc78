package personal.court.scheduler.credential.adapter.in.web.dto;

import personal.court.scheduler.credential.domain.model.CredentialHealth;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;

/**
 * 인증 상태 응답 DTO (토큰 값은 포함하지 않음)
 */
public record CredentialStatusResponse(
        String status,
        boolean hasAccessToken,
        boolean accessTokenValid,
        OffsetDateTime accessExpiry,
        Long accessExpiresInSeconds,
        boolean hasRefreshToken,
        boolean refreshTokenExpired,
        boolean refreshTokenRejected,
        OffsetDateTime refreshExpiry,
        Double daysUntilRefreshExpires,
        OffsetDateTime lastRefreshAt,
        OffsetDateTime lastRefreshAttemptAt,
        String lastRefreshError,
        String accessTokenRejection,
        List<String> reasons
) {
    public static CredentialStatusResponse from(CredentialHealth health, ZoneId zone) {
        return new CredentialStatusResponse(
                health.level().name().toLowerCase(Locale.ROOT),
                health.hasAccessToken(),
                health.accessTokenValid(),
                at(health.accessExpiry(), zone),
                health.accessExpiresInSeconds(),
                health.hasRefreshToken(),
                health.refreshTokenExpired(),
                health.refreshTokenRejected(),
                at(health.refreshExpiry(), zone),
                health.refreshExpiresInDays(),
                at(health.lastRefreshAt(), zone),
                at(health.lastRefreshAttemptAt(), zone),
                health.lastRefreshError(),
                health.accessTokenRejection(),
                health.reasons()
        );
    }

    private static OffsetDateTime at(Instant instant, ZoneId zone) {
        return instant == null ? null : instant.atZone(zone).toOffsetDateTime();
    }
}
