package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

/**
 * Job Not Found Exception
 */
public class JobNotFoundException extends BusinessException {
    public JobNotFoundException(Long jobId) {
        super(ErrorCode.JOB_NOT_FOUND, String.format("Job not found: jobId=%d", jobId));
    }
}
