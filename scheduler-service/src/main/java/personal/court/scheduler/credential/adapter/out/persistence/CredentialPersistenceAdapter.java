package personal.court.scheduler.credential.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.court.scheduler.credential.application.port.out.CredentialRepository;
import personal.court.scheduler.credential.domain.model.Credential;

import java.util.Optional;

/**
 * Credential Persistence Adapter
 * 항상 첫 번째 행만 읽고 쓴다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialPersistenceAdapter implements CredentialRepository {

    private final JpaCredentialRepository jpaCredentialRepository;

    @Override
    public Optional<Credential> load() {
        return jpaCredentialRepository.findFirstByOrderByIdAsc()
                .map(CredentialEntity::toDomain);
    }

    @Override
    @Transactional
    public Credential save(Credential credential) {
        Credential target = credential;
        if (credential.id() == null) {
            // 기존 행이 있으면 새 행을 만들지 않고 덮어씀
            target = jpaCredentialRepository.findFirstByOrderByIdAsc()
                    .map(existing -> new Credential(existing.getId(), credential.accessToken(),
                            credential.accessExpiry(), credential.refreshToken(), credential.refreshExpiry(),
                            credential.sessionState(), credential.lastRefreshAt()))
                    .orElse(credential);
        }
        CredentialEntity saved = jpaCredentialRepository.save(CredentialEntity.fromDomain(target));
        log.debug("Credential saved: id={}, accessExpiry={}", saved.getId(), saved.getAccessExpiry());
        return saved.toDomain();
    }
}
