package personal.court.scheduler.booking.application.port.in;

/**
 * Get Scheduler Alerts UseCase (Input Port)
 * 인증 상태와 다가오는 작업을 합쳐 운영자 조치가 필요한 항목을 계산
 */
public interface GetSchedulerAlertsUseCase {

    SchedulerAlerts getAlerts();
}
