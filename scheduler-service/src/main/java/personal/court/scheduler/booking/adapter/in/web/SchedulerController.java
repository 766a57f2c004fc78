package personal.court.scheduler.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.court.common.dto.ApiResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.JobStatsResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.SchedulerAlertsResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.SchedulerStatusResponse;
import personal.court.scheduler.booking.application.port.in.GetJobStatsUseCase;
import personal.court.scheduler.booking.application.port.in.GetSchedulerAlertsUseCase;
import personal.court.scheduler.booking.application.port.in.GetSchedulerStatusUseCase;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Scheduler Monitoring API Controller
 * 스케줄러 상태, 운영 알림, 작업 통계
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SchedulerController {

    private final GetSchedulerStatusUseCase getSchedulerStatusUseCase;
    private final GetSchedulerAlertsUseCase getSchedulerAlertsUseCase;
    private final GetJobStatsUseCase getJobStatsUseCase;
    private final TriggerCalculator triggerCalculator;
    private final Clock clock;

    /**
     * GET /api/v1/scheduler/status
     */
    @GetMapping("/scheduler/status")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> getStatus() {
        SchedulerStatusResponse data = SchedulerStatusResponse.from(
                getSchedulerStatusUseCase.getStatus(), triggerCalculator.courtZone());

        if (data.running()) {
            return ResponseEntity.ok(ApiResponse.success("Scheduler is running", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Scheduler is not running", data));
    }

    /**
     * GET /api/v1/scheduler/alerts
     */
    @GetMapping("/scheduler/alerts")
    public ResponseEntity<SchedulerAlertsResponse> getAlerts() {
        OffsetDateTime checkedAt = clock.instant().atZone(triggerCalculator.courtZone()).toOffsetDateTime();
        return ResponseEntity.ok(SchedulerAlertsResponse.from(getSchedulerAlertsUseCase.getAlerts(), checkedAt));
    }

    /**
     * GET /api/v1/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<JobStatsResponse> getStats() {
        return ResponseEntity.ok(JobStatsResponse.from(getJobStatsUseCase.getStats(), triggerCalculator.courtZone()));
    }
}
