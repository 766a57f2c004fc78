package personal.court.scheduler.booking.adapter.in.web.dto;

import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort.SchedulerSnapshot;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.List;

/**
 * 스케줄러 상태 응답 DTO
 *
 * @param armed 대기 중인 트리거 (트리거 시각 순)
 */
public record SchedulerStatusResponse(
        boolean running,
        int armedCount,
        OffsetDateTime nextTrigger,
        List<ArmedTriggerResponse> armed
) {
    public record ArmedTriggerResponse(Long jobId, OffsetDateTime triggerTime) {
    }

    public static SchedulerStatusResponse from(SchedulerSnapshot snapshot, ZoneId zone) {
        List<ArmedTriggerResponse> armed = snapshot.armed().stream()
                .map(trigger -> new ArmedTriggerResponse(
                        trigger.jobId(),
                        trigger.triggerTime().atZone(zone).toOffsetDateTime()))
                .toList();
        return new SchedulerStatusResponse(
                snapshot.running(),
                armed.size(),
                armed.isEmpty() ? null : armed.get(0).triggerTime(),
                armed
        );
    }
}
