package personal.court.scheduler.booking.application.port.in;

import personal.court.scheduler.booking.domain.model.Job;

/**
 * 작업 통계
 *
 * @param nextBooking 가장 가까운 미래의 PENDING 작업 (없으면 null)
 */
public record JobStats(
        long total,
        long pending,
        long success,
        long failed,
        long cancelled,
        Job nextBooking
) {
}
