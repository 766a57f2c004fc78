package personal.court.scheduler.booking.domain.model;

/**
 * Job Kind Enum
 */
public enum JobKind {
    /**
     * 단건 예약 의도에서 생성
     */
    SINGLE,

    /**
     * 반복 규칙을 전개한 개별 회차
     */
    RECURRING_INSTANCE
}
