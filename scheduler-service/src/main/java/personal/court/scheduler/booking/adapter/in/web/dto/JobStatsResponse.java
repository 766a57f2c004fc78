package personal.court.scheduler.booking.adapter.in.web.dto;

import personal.court.scheduler.booking.application.port.in.JobStats;

import java.time.ZoneId;

/**
 * 작업 통계 응답 DTO
 */
public record JobStatsResponse(
        long total,
        long pending,
        long success,
        long failed,
        long cancelled,
        JobResponse nextBooking
) {
    public static JobStatsResponse from(JobStats stats, ZoneId zone) {
        return new JobStatsResponse(
                stats.total(),
                stats.pending(),
                stats.success(),
                stats.failed(),
                stats.cancelled(),
                stats.nextBooking() == null ? null : JobResponse.from(stats.nextBooking(), zone)
        );
    }
}
