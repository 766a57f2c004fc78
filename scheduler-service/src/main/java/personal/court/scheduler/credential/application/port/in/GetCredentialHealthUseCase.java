package personal.court.scheduler.credential.application.port.in;

import personal.court.scheduler.credential.domain.model.CredentialHealth;

/**
 * Get Credential Health UseCase (Input Port)
 */
public interface GetCredentialHealthUseCase {

    CredentialHealth health();
}
