package personal.court.scheduler.booking.adapter.out.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.domain.exception.InvalidJobTransitionException;
import personal.court.scheduler.booking.domain.exception.JobNotFoundException;
import personal.court.scheduler.booking.domain.exception.JobStatusConflictException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job Persistence Adapter
 * JPA를 사용한 예약 작업 저장소 구현체
 *
 * 상태 변경은 조건부 UPDATE(compare-and-set)로만 수행되므로
 * 스케줄러와 API가 동시에 같은 작업을 바꾸려 해도 한쪽만 성공한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobPersistenceAdapter implements JobRepository {

    private final JpaJobRepository jpaJobRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    @Override
    public Optional<Job> findById(Long jobId) {
        return jpaJobRepository.findById(jobId)
                .map(JobEntity::toDomain);
    }

    /**
     * 중복 검사 후 저장
     * 동시 적재로 유니크 제약에 걸리면 중복으로 간주 (DB Unique Index가 2차 방어선)
     */
    @Override
    public Optional<Job> insertIfAbsent(Job job) {
        String dedupKey = job.dedupKey();
        if (jpaJobRepository.existsByDedupKey(dedupKey)) {
            log.debug("Job already exists, skipping: dedupKey={}", dedupKey);
            return Optional.empty();
        }

        try {
            JobEntity saved = jpaJobRepository.saveAndFlush(JobEntity.fromDomain(job, clock.instant()));
            log.debug("Job inserted: jobId={}, triggerTime={}, courtId={}",
                    saved.getId(), saved.getTriggerTime(), saved.getCourtId());
            return Optional.of(saved.toDomain());
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert of same job detected, skipping: dedupKey={}", dedupKey);
            return Optional.empty();
        }
    }

    @Override
    public List<Job> findPendingBefore(Instant cutoff) {
        return jpaJobRepository.findByStatusAndTriggerTimeLessThanOrderByTriggerTimeAscIdAsc(JobStatus.PENDING, cutoff)
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Override
    public List<Job> findAllPending() {
        return jpaJobRepository.findByStatusOrderByTriggerTimeAscIdAsc(JobStatus.PENDING)
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Override
    public List<Job> search(JobStatus status, CourtId courtId, int offset, int limit) {
        List<String> conditions = new ArrayList<>();
        if (status != null) {
            conditions.add("j.status = :status");
        }
        if (courtId != null) {
            conditions.add("j.courtId = :courtId");
        }
        String jpql = "SELECT j FROM JobEntity j"
                + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions))
                + " ORDER BY j.desiredTime DESC, j.id DESC";

        TypedQuery<JobEntity> query = entityManager.createQuery(jpql, JobEntity.class);
        if (status != null) {
            query.setParameter("status", status);
        }
        if (courtId != null) {
            query.setParameter("courtId", courtId);
        }
        return query.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList()
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Override
    public List<Job> findPendingDesiredBetween(Instant from, Instant to) {
        return jpaJobRepository
                .findByStatusAndDesiredTimeGreaterThanEqualAndDesiredTimeLessThanOrderByDesiredTimeAsc(
                        JobStatus.PENDING, from, to)
                .stream()
                .map(JobEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<Job> findNextPendingDesiredAfter(Instant now) {
        return jpaJobRepository.findFirstByStatusAndDesiredTimeGreaterThanEqualOrderByDesiredTimeAsc(JobStatus.PENDING, now)
                .map(JobEntity::toDomain);
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (Object[] row : jpaJobRepository.countGroupByStatus()) {
            counts.put((JobStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional
    public Job updateStatus(Long jobId, JobStatus newStatus, JobStatus expectedStatus, String reason) {
        int updated = jpaJobRepository.compareAndSetStatus(jobId, expectedStatus, newStatus, reason, clock.instant());
        if (updated == 0) {
            Job current = findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            throw new JobStatusConflictException(jobId, expectedStatus, current.status());
        }
        log.debug("Job status updated: jobId={}, {} -> {}", jobId, expectedStatus, newStatus);
        return findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Override
    @Transactional
    public Job cancel(Long jobId) {
        try {
            return updateStatus(jobId, JobStatus.CANCELLED, JobStatus.PENDING, "Cancelled by operator");
        } catch (JobStatusConflictException e) {
            throw new InvalidJobTransitionException(jobId, e.getCurrentStatus());
        }
    }
}
