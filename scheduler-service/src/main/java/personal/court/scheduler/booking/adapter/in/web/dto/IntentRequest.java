package personal.court.scheduler.booking.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import personal.court.scheduler.booking.application.port.in.BookingIntent;

/**
 * 예약 의도 요청 DTO (schedules.json 항목과 같은 형식)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentRequest(
        @NotBlank(message = "type is required")
        @JsonProperty("type") String type,

        @JsonProperty("desired_time") String desiredTime,

        @JsonProperty("court_id") String courtId,

        @Positive(message = "duration must be positive")
        @JsonProperty("duration") Integer duration,

        @JsonProperty("rrule") String rrule
) {
    public BookingIntent toIntent() {
        return new BookingIntent(type, desiredTime, courtId, duration, rrule);
    }
}
