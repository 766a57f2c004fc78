package personal.court.scheduler.booking.application.port.out;

import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job Repository (Output Port)
 * 예약 작업 영속 저장소. 재시작 후에도 유지되는 유일한 진실의 원천
 *
 * 모든 변경은 개별 트랜잭션으로 커밋된다.
 */
public interface JobRepository {

    Optional<Job> findById(Long jobId);

    /**
     * 중복이 아니면 저장
     * (court, desiredTime, recurrenceRule) 조합이 이미 있으면 아무것도 하지 않는다.
     *
     * @return 저장된 작업 (중복이면 empty)
     */
    Optional<Job> insertIfAbsent(Job job);

    /**
     * cutoff 이전에 트리거되는 PENDING 작업 (triggerTime 오름차순)
     */
    List<Job> findPendingBefore(Instant cutoff);

    /**
     * 모든 PENDING 작업 (triggerTime 오름차순)
     */
    List<Job> findAllPending();

    /**
     * 조건 검색 (desiredTime 내림차순)
     *
     * @param status  상태 필터 (null이면 전체)
     * @param courtId 코트 필터 (null이면 전체)
     */
    List<Job> search(JobStatus status, CourtId courtId, int offset, int limit);

    /**
     * desiredTime이 [from, to) 구간에 있는 PENDING 작업 (desiredTime 오름차순)
     */
    List<Job> findPendingDesiredBetween(Instant from, Instant to);

    Optional<Job> findNextPendingDesiredAfter(Instant now);

    Map<JobStatus, Long> countByStatus();

    /**
     * 상태 compare-and-set
     *
     * @throws personal.court.scheduler.booking.domain.exception.JobStatusConflictException 현재 상태가 expected가 아닐 때
     * @throws personal.court.scheduler.booking.domain.exception.JobNotFoundException      작업이 없을 때
     */
    Job updateStatus(Long jobId, JobStatus newStatus, JobStatus expectedStatus, String reason);

    /**
     * PENDING 작업 취소
     *
     * @throws personal.court.scheduler.booking.domain.exception.InvalidJobTransitionException PENDING이 아닐 때
     * @throws personal.court.scheduler.booking.domain.exception.JobNotFoundException          작업이 없을 때
     */
    Job cancel(Long jobId);
}
