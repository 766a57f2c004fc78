package personal.court.scheduler.booking.application.port.in;

import personal.court.scheduler.booking.domain.model.Job;

import java.util.List;

/**
 * Get Job UseCase (Input Port)
 * 작업 조회 (읽기 전용)
 */
public interface GetJobUseCase {

    /**
     * @throws personal.court.scheduler.booking.domain.exception.JobNotFoundException 작업이 없을 때
     */
    Job getJob(Long jobId);

    List<Job> searchJobs(JobSearchQuery query);

    /**
     * 앞으로 days일 안에 사용할 PENDING 작업 (desiredTime 오름차순)
     *
     * @param days 1 ~ 30
     */
    List<Job> getUpcomingJobs(int days);
}
