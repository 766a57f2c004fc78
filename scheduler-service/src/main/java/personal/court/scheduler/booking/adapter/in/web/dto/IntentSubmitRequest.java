package personal.court.scheduler.booking.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * 예약 의도 일괄 등록 요청 DTO
 */
public record IntentSubmitRequest(
        @NotEmpty(message = "intents must not be empty")
        List<@Valid IntentRequest> intents
) {
}
