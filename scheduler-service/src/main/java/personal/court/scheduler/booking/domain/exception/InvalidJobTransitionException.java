package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.domain.model.JobStatus;

/**
 * Invalid Job Transition Exception
 * PENDING이 아닌 작업을 취소하려 할 때 발생
 */
public class InvalidJobTransitionException extends BusinessException {
    public InvalidJobTransitionException(Long jobId, JobStatus currentStatus) {
        super(ErrorCode.INVALID_JOB_TRANSITION,
                String.format("Only pending jobs can be cancelled: jobId=%d, status=%s", jobId, currentStatus));
    }
}
