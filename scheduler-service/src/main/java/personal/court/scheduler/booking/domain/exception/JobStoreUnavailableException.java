package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Job Store Unavailable Exception
 * 작업 저장소 자체에 접근할 수 없을 때 발생 (프로세스 치명 오류)
 */
public class JobStoreUnavailableException extends BusinessException {
    public JobStoreUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
