package personal.court.scheduler.booking.application.port.in;

import personal.court.scheduler.booking.domain.model.Job;

/**
 * Cancel Job UseCase (Input Port)
 */
public interface CancelJobUseCase {

    /**
     * PENDING 작업 취소
     *
     * @throws personal.court.scheduler.booking.domain.exception.InvalidJobTransitionException PENDING이 아닐 때 (400)
     * @throws personal.court.scheduler.booking.domain.exception.JobNotFoundException          작업이 없을 때 (404)
     */
    Job cancel(Long jobId);
}
