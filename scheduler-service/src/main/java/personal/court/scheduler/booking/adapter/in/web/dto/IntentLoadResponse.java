package personal.court.scheduler.booking.adapter.in.web.dto;

import personal.court.scheduler.booking.application.port.in.IntentLoadReport;

import java.util.List;

/**
 * 예약 의도 적재 결과 응답 DTO
 */
public record IntentLoadResponse(
        int intents,
        int created,
        int duplicates,
        int rejected,
        List<Long> createdJobIds,
        List<String> errors
) {
    public static IntentLoadResponse from(IntentLoadReport report) {
        return new IntentLoadResponse(
                report.intents(),
                report.created(),
                report.duplicates(),
                report.rejected(),
                report.createdJobIds(),
                report.errors()
        );
    }
}
