package personal.court.scheduler.credential.application.port.in;

import personal.court.scheduler.credential.domain.model.CredentialHealth;

/**
 * Manage Credential UseCase (Input Port)
 */
public interface ManageCredentialUseCase {

    /**
     * 시작 시 토큰 파일의 리프레시 토큰 등록 (네트워크 호출 없음)
     */
    void bootstrap(String refreshToken);

    /**
     * 운영자가 제공한 새 리프레시 토큰으로 즉시 갱신
     */
    CredentialHealth rotate(String refreshToken);

    /**
     * 액세스 토큰이 곧 만료되면 미리 갱신
     *
     * @return 갱신했으면 true
     */
    boolean refreshIfExpiringSoon();
}
