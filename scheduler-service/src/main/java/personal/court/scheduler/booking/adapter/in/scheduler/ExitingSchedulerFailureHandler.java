package personal.court.scheduler.booking.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * 치명 오류 시 애플리케이션을 종료 코드 1로 내린다.
 * 저장소가 없으면 실행 결과를 기록할 수 없으므로 계속 돌지 않고 재시작에 맡긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExitingSchedulerFailureHandler implements SchedulerFailureHandler {

    private final ConfigurableApplicationContext applicationContext;

    @Override
    public void onFatal(Throwable cause) {
        log.error("Job store unavailable, shutting down: error={}", cause.getMessage(), cause);
        // 종료는 별도 스레드에서 (lifecycle stop이 트리거 루프를 join하므로)
        Thread exitThread = new Thread(
                () -> System.exit(SpringApplication.exit(applicationContext, () -> 1)),
                "scheduler-fatal-exit");
        exitThread.start();
    }
}
