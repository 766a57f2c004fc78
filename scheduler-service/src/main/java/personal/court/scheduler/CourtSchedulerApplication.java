package personal.court.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Court Scheduler Application
 * 코트 예약 요청을 예약 가능 시점(사용 시각 168시간 전)에 자동으로 제출하는 서비스
 */
@EnableScheduling  // Credential 선제 갱신 스케줄러 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.court.scheduler",
        "personal.court.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class CourtSchedulerApplication {
    public static void main(String[] args) {
        SpringApplication.run(CourtSchedulerApplication.class, args);
    }
}
