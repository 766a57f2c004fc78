package personal.court.scheduler.credential.application.port.out;

import personal.court.scheduler.credential.domain.model.Credential;

import java.util.Optional;

/**
 * Credential Repository (Output Port)
 * 인증 정보는 항상 한 행만 존재
 */
public interface CredentialRepository {

    Optional<Credential> load();

    Credential save(Credential credential);
}
