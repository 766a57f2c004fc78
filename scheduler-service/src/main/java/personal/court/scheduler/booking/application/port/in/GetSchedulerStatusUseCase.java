package personal.court.scheduler.booking.application.port.in;

import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort.SchedulerSnapshot;

/**
 * Get Scheduler Status UseCase (Input Port)
 * 스케줄러 생존 여부와 대기 중인 트리거 목록
 */
public interface GetSchedulerStatusUseCase {

    SchedulerSnapshot getStatus();
}
