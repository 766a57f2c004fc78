package personal.court.scheduler.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobKind;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Instant;

/**
 * Booking Job JPA Entity
 * 예약 작업 테이블 매핑
 * dedup_key 유니크 제약이 같은 의도의 중복 적재를 막는 최종 방어선
 */
@Entity
@Table(name = "booking_jobs",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_booking_jobs_dedup",
                columnNames = {"dedup_key"}
        ),
        indexes = {
                @Index(name = "idx_booking_jobs_status_trigger", columnList = "status, trigger_time"),
                @Index(name = "idx_booking_jobs_desired", columnList = "desired_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private JobKind kind;

    @Column(name = "desired_time", nullable = false)
    private Instant desiredTime;

    @Column(name = "trigger_time", nullable = false)
    private Instant triggerTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "court_id", nullable = false, length = 20)
    private CourtId courtId;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "recurrence_rule", length = 512)
    private String recurrenceRule;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "status_reason", length = 1000)
    private String statusReason;

    @Column(name = "dedup_key", nullable = false, length = 600)
    private String dedupKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * 도메인 모델로부터 신규 엔티티 생성
     */
    public static JobEntity fromDomain(Job job, Instant now) {
        JobEntity entity = new JobEntity();
        entity.id = job.id();
        entity.kind = job.kind();
        entity.desiredTime = job.desiredTime();
        entity.triggerTime = job.triggerTime();
        entity.courtId = job.courtId();
        entity.durationMinutes = job.durationMinutes();
        entity.recurrenceRule = job.recurrenceRule();
        entity.status = job.status();
        entity.statusReason = job.statusReason();
        entity.dedupKey = job.dedupKey();
        entity.createdAt = job.createdAt() != null ? job.createdAt() : now;
        entity.updatedAt = job.updatedAt() != null ? job.updatedAt() : now;
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Job toDomain() {
        return new Job(id, kind, desiredTime, triggerTime, courtId, durationMinutes,
                recurrenceRule, status, statusReason, createdAt, updatedAt);
    }
}
