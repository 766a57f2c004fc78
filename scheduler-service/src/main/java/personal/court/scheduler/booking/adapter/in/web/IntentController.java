package personal.court.scheduler.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.court.common.dto.ApiResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.IntentLoadResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.IntentRequest;
import personal.court.scheduler.booking.adapter.in.web.dto.IntentSubmitRequest;
import personal.court.scheduler.booking.application.port.in.IntentLoadReport;
import personal.court.scheduler.booking.application.port.in.LoadIntentsUseCase;

/**
 * Booking Intent API Controller
 * 실행 중에 예약 의도를 추가 (파일 적재와 같은 규칙, 중복은 무시)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/intents")
@RequiredArgsConstructor
public class IntentController {

    private final LoadIntentsUseCase loadIntentsUseCase;

    /**
     * 예약 의도 등록
     * POST /api/v1/intents
     */
    @PostMapping
    public ResponseEntity<ApiResponse<IntentLoadResponse>> submitIntents(
            @Valid @RequestBody IntentSubmitRequest request
    ) {
        log.info("Submit booking intents: count={}", request.intents().size());

        IntentLoadReport report = loadIntentsUseCase.load(
                request.intents().stream().map(IntentRequest::toIntent).toList());

        IntentLoadResponse data = IntentLoadResponse.from(report);
        if (report.rejected() > 0) {
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(ApiResponse.error("Some intents were rejected", data));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Intents loaded", data));
    }
}
