package personal.court.scheduler.credential.application.port.in;

/**
 * Get Access Token UseCase (Input Port)
 */
public interface GetAccessTokenUseCase {

    /**
     * 안전 여유 시간 이상 유효한 액세스 토큰 반환 (필요하면 먼저 갱신)
     * 동시에 호출해도 갱신 요청은 한 번만 나간다.
     *
     * @throws personal.court.scheduler.credential.domain.exception.CredentialExpiredException   리프레시 토큰 만료
     * @throws personal.court.scheduler.booking.domain.exception.TransientExecutionException 갱신 실패 또는 대기 시간 초과
     */
    String getValidAccessToken();

    /**
     * 예약 API가 액세스 토큰을 401로 거부했음을 알림
     * 캐시된 토큰이 거부된 토큰과 같으면 폐기하여 다음 요청이 갱신을 수행하게 하고, CRITICAL 인증 알림을 남긴다.
     *
     * @param accessToken 거부된 액세스 토큰
     * @param reason      거부 사유 (로그와 알림에 노출)
     */
    void invalidateAccessToken(String accessToken, String reason);

    /**
     * 예약 API가 액세스 토큰을 받아들였음을 알림 (거부 알림 해제)
     */
    void confirmAccessToken();
}
