package personal.court.scheduler.booking.domain.model;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;

import java.time.Instant;

/**
 * Job Domain Model
 * 예약 제출 작업 (불변)
 *
 * triggerTime은 항상 desiredTime - 168h 이며 생성 후 변경되지 않는다.
 */
public record Job(
        Long id,
        JobKind kind,
        Instant desiredTime,
        Instant triggerTime,
        CourtId courtId,
        int durationMinutes,
        String recurrenceRule,
        JobStatus status,
        String statusReason,
        Instant createdAt,
        Instant updatedAt) {

    public Job {
        if (kind == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Job kind cannot be null");
        }
        if (desiredTime == null || triggerTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Desired and trigger time cannot be null");
        }
        if (!triggerTime.equals(TriggerCalculator.triggerFor(desiredTime))) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Trigger time must be desired time minus %s: desired=%s, trigger=%s",
                            TriggerCalculator.ADVANCE_WINDOW, desiredTime, triggerTime));
        }
        if (courtId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Court ID cannot be null");
        }
        if (durationMinutes <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration must be positive: " + durationMinutes);
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Job status cannot be null");
        }
    }

    /**
     * 신규 작업 생성 (PENDING 상태)
     *
     * @param kind            SINGLE 또는 RECURRING_INSTANCE
     * @param desiredTime     코트 사용 시작 시각
     * @param courtId         코트
     * @param durationMinutes 사용 시간 (분)
     * @param recurrenceRule  반복 규칙 원문 (단건이면 null)
     */
    public static Job create(JobKind kind, Instant desiredTime, CourtId courtId,
                             int durationMinutes, String recurrenceRule) {
        return new Job(
                null,
                kind,
                desiredTime,
                TriggerCalculator.triggerFor(desiredTime),
                courtId,
                durationMinutes,
                recurrenceRule,
                JobStatus.PENDING,
                null,
                null,
                null);
    }

    public boolean isPending() {
        return status == JobStatus.PENDING;
    }

    public Instant endTime() {
        return desiredTime.plusSeconds(durationMinutes * 60L);
    }

    /**
     * 중복 판별 키: (court, desiredTime, recurrenceRule 또는 null)
     * 같은 의도를 여러 번 적재해도 작업이 중복 생성되지 않도록 저장소의 유니크 키로 사용
     */
    public String dedupKey() {
        return courtId.getCode() + "|" + desiredTime + "|" + (recurrenceRule == null ? "-" : recurrenceRule);
    }
}
