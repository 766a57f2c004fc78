package personal.court.scheduler.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.court.common.dto.ApiResponse;
import personal.court.scheduler.booking.adapter.in.web.dto.JobResponse;
import personal.court.scheduler.booking.application.port.in.CancelJobUseCase;
import personal.court.scheduler.booking.application.port.in.GetJobUseCase;
import personal.court.scheduler.booking.application.port.in.JobSearchQuery;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;

import java.util.List;

/**
 * Booking Job API Controller
 * 예약 작업 조회 및 취소 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final GetJobUseCase getJobUseCase;
    private final CancelJobUseCase cancelJobUseCase;
    private final TriggerCalculator triggerCalculator;

    /**
     * 작업 목록 조회 (사용 시각 내림차순)
     * GET /api/v1/jobs?status=pending&courtId=1&limit=100&offset=0
     */
    @GetMapping
    public ResponseEntity<List<JobResponse>> getJobs(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String courtId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        log.debug("Get jobs: status={}, courtId={}, limit={}, offset={}", status, courtId, limit, offset);

        JobSearchQuery query = new JobSearchQuery(
                status == null ? null : JobStatus.from(status),
                courtId == null ? null : CourtId.fromCode(courtId),
                offset,
                limit);

        return ResponseEntity.ok(toResponses(getJobUseCase.searchJobs(query)));
    }

    /**
     * 다가오는 PENDING 작업 조회
     * GET /api/v1/jobs/upcoming?days=7
     */
    @GetMapping("/upcoming")
    public ResponseEntity<List<JobResponse>> getUpcomingJobs(
            @RequestParam(defaultValue = "7") int days
    ) {
        log.debug("Get upcoming jobs: days={}", days);
        return ResponseEntity.ok(toResponses(getJobUseCase.getUpcomingJobs(days)));
    }

    /**
     * 작업 단건 조회
     * GET /api/v1/jobs/{jobId}
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<JobResponse> getJob(@PathVariable Long jobId) {
        Job job = getJobUseCase.getJob(jobId);
        return ResponseEntity.ok(JobResponse.from(job, triggerCalculator.courtZone()));
    }

    /**
     * 작업 취소 (PENDING만 가능)
     * DELETE /api/v1/jobs/{jobId}
     */
    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<JobResponse>> cancelJob(@PathVariable Long jobId) {
        log.info("Cancel job requested: jobId={}", jobId);

        Job cancelled = cancelJobUseCase.cancel(jobId);

        return ResponseEntity.ok(
                ApiResponse.success("Job cancelled", JobResponse.from(cancelled, triggerCalculator.courtZone()))
        );
    }

    private List<JobResponse> toResponses(List<Job> jobs) {
        return jobs.stream()
                .map(job -> JobResponse.from(job, triggerCalculator.courtZone()))
                .toList();
    }
}
