package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Definitive Rejection Exception
 * 슬롯 없음, 잘못된 요청 등 재시도해도 결과가 같은 거절 (재시도 없이 FAILED)
 */
public class DefinitiveRejectionException extends BusinessException {
    public DefinitiveRejectionException(String message) {
        super(ErrorCode.BOOKING_REJECTED, message);
    }
}
