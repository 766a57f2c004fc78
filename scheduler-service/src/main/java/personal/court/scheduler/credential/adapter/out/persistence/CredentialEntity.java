package personal.court.scheduler.credential.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.court.scheduler.credential.domain.model.Credential;

import java.time.Instant;

/**
 * Credential JPA Entity
 * 인증 토큰 테이블 매핑 (단일 행)
 */
@Entity
@Table(name = "credentials")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CredentialEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "access_token", length = 4000)
    private String accessToken;

    @Column(name = "access_expiry")
    private Instant accessExpiry;

    @Column(name = "refresh_token", length = 4000)
    private String refreshToken;

    @Column(name = "refresh_expiry")
    private Instant refreshExpiry;

    @Column(name = "session_state", length = 200)
    private String sessionState;

    @Column(name = "last_refresh_at")
    private Instant lastRefreshAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static CredentialEntity fromDomain(Credential credential) {
        CredentialEntity entity = new CredentialEntity();
        entity.id = credential.id();
        entity.accessToken = credential.accessToken();
        entity.accessExpiry = credential.accessExpiry();
        entity.refreshToken = credential.refreshToken();
        entity.refreshExpiry = credential.refreshExpiry();
        entity.sessionState = credential.sessionState();
        entity.lastRefreshAt = credential.lastRefreshAt();
        return entity;
    }

    @PrePersist
    @PreUpdate
    protected void onSave() {
        updatedAt = Instant.now();
    }

    public Credential toDomain() {
        return new Credential(id, accessToken, accessExpiry, refreshToken, refreshExpiry, sessionState, lastRefreshAt);
    }
}
