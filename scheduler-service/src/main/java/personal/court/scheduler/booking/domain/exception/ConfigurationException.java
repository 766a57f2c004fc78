package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Configuration Exception
 * 예약 의도 또는 반복 규칙이 잘못되었을 때 발생 (적재 시점에 해당 의도만 건너뜀)
 */
public class ConfigurationException extends BusinessException {

    private final String field;

    public ConfigurationException(String field, String message) {
        super(ErrorCode.INVALID_INTENT, String.format("Invalid %s: %s", field, message));
        this.field = field;
    }

    /**
     * 문제가 된 필드 이름 (예: "BYDAY", "desired_time")
     */
    public String getField() {
        return field;
    }
}
