package personal.court.scheduler.booking.application.port.in;

/**
 * 작업 1회 실행 결과
 */
public enum ExecutionOutcome {
    /**
     * 예약 접수, SUCCESS 기록
     */
    SUCCEEDED,

    /**
     * 거절, 재시도 소진 또는 인증 만료로 FAILED 기록
     */
    FAILED,

    /**
     * 이미 PENDING이 아니어서 아무것도 하지 않음
     */
    SKIPPED,

    /**
     * 결과 기록 시점에 다른 쪽이 먼저 상태를 바꿈 (예: 취소)
     */
    CONFLICT,

    /**
     * 종료 중 인터럽트, PENDING 유지 (재시작 후 다시 실행)
     */
    INTERRUPTED
}
