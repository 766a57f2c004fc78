package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Transient Execution Exception
 * 네트워크 오류, 5xx, Rate Limit 등 재시도로 회복 가능한 실패
 */
public class TransientExecutionException extends BusinessException {
    public TransientExecutionException(String message) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, message);
    }

    public TransientExecutionException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_ERROR, message, cause);
    }

    public TransientExecutionException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
