package personal.court.scheduler.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.application.port.in.GetJobStatsUseCase;
import personal.court.scheduler.booking.application.port.in.GetJobUseCase;
import personal.court.scheduler.booking.application.port.in.JobSearchQuery;
import personal.court.scheduler.booking.application.port.in.JobStats;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.domain.exception.JobNotFoundException;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Job Query Service
 * 작업 조회 및 통계 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueryService implements GetJobUseCase, GetJobStatsUseCase {

    private static final int MAX_UPCOMING_DAYS = 30;

    private final JobRepository jobRepository;
    private final Clock clock;

    @Override
    public Job getJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    public List<Job> searchJobs(JobSearchQuery query) {
        log.debug("Searching jobs: status={}, courtId={}, offset={}, limit={}",
                query.status(), query.courtId(), query.offset(), query.limit());
        return jobRepository.search(query.status(), query.courtId(), query.offset(), query.limit());
    }

    @Override
    public List<Job> getUpcomingJobs(int days) {
        if (days < 1 || days > MAX_UPCOMING_DAYS) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Days must be between 1 and %d: %d", MAX_UPCOMING_DAYS, days));
        }
        Instant now = clock.instant();
        return jobRepository.findPendingDesiredBetween(now, now.plus(Duration.ofDays(days)));
    }

    @Override
    public JobStats getStats() {
        Map<JobStatus, Long> counts = jobRepository.countByStatus();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Job next = jobRepository.findNextPendingDesiredAfter(clock.instant()).orElse(null);
        return new JobStats(
                total,
                counts.getOrDefault(JobStatus.PENDING, 0L),
                counts.getOrDefault(JobStatus.SUCCESS, 0L),
                counts.getOrDefault(JobStatus.FAILED, 0L),
                counts.getOrDefault(JobStatus.CANCELLED, 0L),
                next);
    }
}
