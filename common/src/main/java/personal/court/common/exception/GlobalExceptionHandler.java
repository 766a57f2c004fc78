package personal.court.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * 전역 예외 처리 핸들러
 * BusinessException은 ErrorCode의 HTTP Status로, 요청 형식 오류는 400(C001)으로, 그 외는 500으로 응답
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String INVALID_INPUT_FALLBACK = "입력값이 유효하지 않습니다.";

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("Business exception: code={}, detail={}", errorCode.getCode(), e.getMessage(), e);
        } else {
            log.warn("Business exception: code={}, detail={}", errorCode.getCode(), e.getMessage());
        }
        return respond(errorCode, e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
        log.warn("No handler for path: {}", e.getResourcePath());
        return respond(ErrorCode.NOT_FOUND, "요청한 URL을 찾을 수 없습니다: " + e.getResourcePath());
    }

    /**
     * {@code @RequestBody} 검증 실패 (첫 번째 오류 메시지만 노출)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
        log.warn("Request body validation failed: errors={}", e.getBindingResult().getErrorCount());
        return respond(ErrorCode.INVALID_INPUT, firstMessage(e.getBindingResult().getAllErrors()));
    }

    /**
     * 메서드 파라미터 검증 실패 (List 요소 검증 포함)
     */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleHandlerMethodValidationException(HandlerMethodValidationException e) {
        log.warn("Parameter validation failed: {}", e.getMessage());
        return respond(ErrorCode.INVALID_INPUT, firstMessage(e.getAllErrors()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentTypeMismatchException(MethodArgumentTypeMismatchException e) {
        log.warn("Type mismatch: parameter={}, value={}", e.getName(), e.getValue());
        return respond(ErrorCode.INVALID_INPUT, "파라미터 형식이 올바르지 않습니다: " + e.getName());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingServletRequestParameterException(
            MissingServletRequestParameterException e) {
        log.warn("Missing parameter: {}", e.getParameterName());
        return respond(ErrorCode.INVALID_INPUT, "필수 파라미터가 누락되었습니다: " + e.getParameterName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return respond(ErrorCode.INVALID_INPUT, "요청 본문을 읽을 수 없습니다.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return respond(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorCode errorCode, String message) {
        return ResponseEntity
                .status(errorCode.getHttpStatus())
                .body(ErrorResponse.of(errorCode, message));
    }

    private static String firstMessage(List<? extends MessageSourceResolvable> errors) {
        if (errors.isEmpty() || errors.get(0).getDefaultMessage() == null) {
            return INVALID_INPUT_FALLBACK;
        }
        return errors.get(0).getDefaultMessage();
    }
}
