package personal.court.scheduler.booking.adapter.in.scheduler;

/**
 * 스케줄러가 더 이상 진행할 수 없을 때 (작업 저장소 접근 불가) 호출
 */
@FunctionalInterface
public interface SchedulerFailureHandler {

    void onFatal(Throwable cause);
}
