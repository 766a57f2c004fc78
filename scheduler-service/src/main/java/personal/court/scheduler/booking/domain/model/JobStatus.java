package personal.court.scheduler.booking.domain.model;

import personal.court.common.exception.BusinessException;
import personal.court.common.exception.ErrorCode;

import java.util.Locale;

/**
 * Job Status Enum
 * 예약 작업 상태 (PENDING에서만 전이 가능)
 */
public enum JobStatus {
    /**
     * 트리거 대기 중
     */
    PENDING,

    /**
     * 예약 제출 성공
     */
    SUCCESS,

    /**
     * 거절 또는 재시도 소진
     */
    FAILED,

    /**
     * 외부 요청으로 취소
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * 대소문자 구분 없이 상태 문자열 파싱 ("pending", "SUCCESS" 등)
     */
    public static JobStatus from(String value) {
        try {
            return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Unknown job status: " + value);
        }
    }
}
