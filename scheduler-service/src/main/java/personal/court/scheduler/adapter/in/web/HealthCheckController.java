package personal.court.scheduler.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.court.common.dto.ApiResponse;
import personal.court.common.dto.HealthCheckResponse;
import personal.court.common.health.HealthCheckService;
import personal.court.scheduler.booking.application.port.in.GetSchedulerStatusUseCase;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 작업 저장소(DB)와 트리거 스케줄러 상태를 확인하는 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;
    private final GetSchedulerStatusUseCase getSchedulerStatusUseCase;

    /**
     * Health Check 엔드포인트
     *
     * @return ApiResponse with health check data
     */
    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        String schedulerStatus = getSchedulerStatusUseCase.getStatus().running()
                ? HealthCheckService.UP
                : HealthCheckService.DOWN;

        HealthCheckResponse data = new HealthCheckResponse(databaseStatus, schedulerStatus);

        boolean allHealthy = HealthCheckService.UP.equals(databaseStatus)
                && HealthCheckService.UP.equals(schedulerStatus);

        if (allHealthy) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        } else {
            return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
        }
    }
}
