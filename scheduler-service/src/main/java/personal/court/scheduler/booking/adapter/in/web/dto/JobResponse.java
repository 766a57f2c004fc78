package personal.court.scheduler.booking.adapter.in.web.dto;

import personal.court.scheduler.booking.domain.model.Job;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 예약 작업 응답 DTO (시각은 코트 시간대 offset 포함)
 */
public record JobResponse(
        Long id,
        String kind,
        OffsetDateTime desiredTime,
        OffsetDateTime triggerTime,
        String courtId,
        int durationMinutes,
        String recurrenceRule,
        String status,
        String statusReason,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static JobResponse from(Job job, ZoneId zone) {
        return new JobResponse(
                job.id(),
                job.kind().name(),
                at(job.desiredTime(), zone),
                at(job.triggerTime(), zone),
                job.courtId().getCode(),
                job.durationMinutes(),
                job.recurrenceRule(),
                job.status().name(),
                job.statusReason(),
                at(job.createdAt(), zone),
                at(job.updatedAt(), zone)
        );
    }

    private static OffsetDateTime at(Instant instant, ZoneId zone) {
        return instant == null ? null : instant.atZone(zone).toOffsetDateTime();
    }
}
