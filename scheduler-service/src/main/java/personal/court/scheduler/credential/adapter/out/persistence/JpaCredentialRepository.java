package personal.court.scheduler.credential.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Spring Data JPA Repository for Credential
 */
public interface JpaCredentialRepository extends JpaRepository<CredentialEntity, Long> {

    Optional<CredentialEntity> findFirstByOrderByIdAsc();
}
