package personal.court.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),
    STORE_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "C007", "작업 저장소에 접근할 수 없습니다."),

    // Job Domain (Jxxx)
    INVALID_INTENT(HttpStatus.BAD_REQUEST, "J001", "예약 의도 설정이 올바르지 않습니다."),
    JOB_STATUS_CONFLICT(HttpStatus.CONFLICT, "J002", "작업 상태가 동시에 변경되었습니다."),
    INVALID_JOB_TRANSITION(HttpStatus.BAD_REQUEST, "J003", "대기 중인 작업만 취소할 수 있습니다."),
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, "J004", "작업을 찾을 수 없습니다."),
    BOOKING_REJECTED(HttpStatus.UNPROCESSABLE_ENTITY, "J005", "코트 예약이 거절되었습니다."),

    // Credential (Axxx)
    CREDENTIAL_EXPIRED(HttpStatus.UNAUTHORIZED, "A001", "리프레시 토큰이 만료되었습니다."),
    CREDENTIAL_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "A002", "액세스 토큰을 확보하지 못했습니다."),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스 오류가 발생했습니다."),
    EXTERNAL_SERVICE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "E002", "외부 서비스 응답 시간 초과입니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
