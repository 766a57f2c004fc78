package personal.court.scheduler.credential.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Credential Expired Exception
 * 리프레시 토큰이 없거나 만료되었거나 인증 서버가 거부한 경우
 * 운영자가 새 리프레시 토큰을 등록하기 전까지 회복되지 않음
 */
public class CredentialExpiredException extends BusinessException {
    public CredentialExpiredException(String message) {
        super(ErrorCode.CREDENTIAL_EXPIRED, message);
    }
}
