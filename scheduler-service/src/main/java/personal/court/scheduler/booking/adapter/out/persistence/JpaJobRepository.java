package personal.court.scheduler.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Booking Job
 */
public interface JpaJobRepository extends JpaRepository<JobEntity, Long> {

    boolean existsByDedupKey(String dedupKey);

    /**
     * 트리거 시각이 cutoff 이전인 작업 (트리거 순)
     */
    List<JobEntity> findByStatusAndTriggerTimeLessThanOrderByTriggerTimeAscIdAsc(JobStatus status, Instant cutoff);

    List<JobEntity> findByStatusOrderByTriggerTimeAscIdAsc(JobStatus status);

    /**
     * 사용 시각이 [from, to) 구간인 작업
     */
    List<JobEntity> findByStatusAndDesiredTimeGreaterThanEqualAndDesiredTimeLessThanOrderByDesiredTimeAsc(
            JobStatus status,
            Instant from,
            Instant to
    );

    Optional<JobEntity> findFirstByStatusAndDesiredTimeGreaterThanEqualOrderByDesiredTimeAsc(JobStatus status, Instant from);

    @Query("SELECT j.status, COUNT(j) FROM JobEntity j GROUP BY j.status")
    List<Object[]> countGroupByStatus();

    /**
     * 상태 compare-and-set
     * 현재 상태가 expected일 때만 변경되며, 변경된 행 수(0 또는 1)를 반환
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE JobEntity j SET j.status = :newStatus, j.statusReason = :reason, j.updatedAt = :updatedAt "
            + "WHERE j.id = :id AND j.status = :expected")
    int compareAndSetStatus(@Param("id") Long id,
                            @Param("expected") JobStatus expected,
                            @Param("newStatus") JobStatus newStatus,
                            @Param("reason") String reason,
                            @Param("updatedAt") Instant updatedAt);
}
