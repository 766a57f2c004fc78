package personal.court.scheduler.booking.application.port.out;

import personal.court.scheduler.booking.domain.model.Job;

import java.time.Instant;
import java.util.List;

/**
 * Trigger Scheduler Port
 * 새로 저장되거나 취소된 작업을 실행 중인 스케줄러에 반영
 */
public interface TriggerSchedulerPort {

    void arm(Job job);

    void disarm(Long jobId);

    SchedulerSnapshot snapshot();

    record ArmedTrigger(Long jobId, Instant triggerTime) {
    }

    record SchedulerSnapshot(boolean running, List<ArmedTrigger> armed) {
    }
}
