package personal.court.scheduler.booking.domain.exception;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.domain.model.JobStatus;

/**
 * Job Status Conflict Exception
 * compare-and-set 상태 변경에서 기대 상태가 현재 상태와 다를 때 발생
 * 호출자가 새로 조회해서 처리하며 사용자에게 노출되지 않음
 */
public class JobStatusConflictException extends BusinessException {

    private final JobStatus currentStatus;

    public JobStatusConflictException(Long jobId, JobStatus expectedStatus, JobStatus currentStatus) {
        super(ErrorCode.JOB_STATUS_CONFLICT,
                String.format("Job status changed concurrently: jobId=%d, expected=%s, current=%s",
                        jobId, expectedStatus, currentStatus));
        this.currentStatus = currentStatus;
    }

    public JobStatus getCurrentStatus() {
        return currentStatus;
    }
}
