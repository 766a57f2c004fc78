package personal.court.scheduler.booking.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.scheduler.booking.application.port.in.ExecuteJobUseCase;
import personal.court.scheduler.booking.application.port.in.ExecutionOutcome;
import personal.court.scheduler.booking.application.port.out.CourtReservationClient;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.ReservationRequest;
import personal.court.scheduler.booking.application.port.out.Sleeper;
import personal.court.scheduler.booking.domain.exception.DefinitiveRejectionException;
import personal.court.scheduler.booking.domain.exception.JobStatusConflictException;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;
import personal.court.scheduler.booking.domain.model.RetryPolicy;
import personal.court.scheduler.booking.domain.model.RetryState;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;
import personal.court.scheduler.config.CourtSchedulerProperties;
import personal.court.scheduler.credential.application.port.in.GetAccessTokenUseCase;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;

import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * Job Execution Service
 * 트리거된 작업 1건의 시도 사이클 (토큰 확보 → 예약 제출 → 결과 기록)
 *
 * 결과 분류:
 * - 접수: SUCCESS
 * - 확정 거절: 재시도 없이 FAILED
 * - 일시적 실패: RetryPolicy 한도까지 backoff 후 재시도, 소진 시 FAILED
 * - 인증 만료: 재시도 없이 FAILED (알림은 CredentialManager가 기록)
 *   예약 API의 401이면 캐시된 액세스 토큰을 폐기시켜 다음 작업이 새 토큰으로 시도한다.
 *
 * 결과 기록은 PENDING → 최종 상태 compare-and-set 한 번뿐이다.
 */
@Slf4j
@Service
public class JobExecutionService implements ExecuteJobUseCase {

    private static final String ATTEMPT_METRIC = "court.booking.attempts";

    private final JobRepository jobRepository;
    private final CourtReservationClient courtReservationClient;
    private final GetAccessTokenUseCase getAccessTokenUseCase;
    private final TriggerCalculator triggerCalculator;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;
    private final boolean fallbackToAlternateCourt;

    public JobExecutionService(JobRepository jobRepository,
                               CourtReservationClient courtReservationClient,
                               GetAccessTokenUseCase getAccessTokenUseCase,
                               TriggerCalculator triggerCalculator,
                               RetryPolicy retryPolicy,
                               Sleeper sleeper,
                               MeterRegistry meterRegistry,
                               CourtSchedulerProperties properties) {
        this.jobRepository = jobRepository;
        this.courtReservationClient = courtReservationClient;
        this.getAccessTokenUseCase = getAccessTokenUseCase;
        this.triggerCalculator = triggerCalculator;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
        this.fallbackToAlternateCourt = properties.execution().fallbackToAlternateCourt();
    }

    @Override
    public ExecutionOutcome execute(Long jobId) {
        Job job = jobRepository.findById(jobId).orElse(null);
        if (job == null || !job.isPending()) {
            log.info("Job no longer pending, nothing to do: jobId={}, status={}",
                    jobId, job == null ? "ABSENT" : job.status());
            return ExecutionOutcome.SKIPPED;
        }

        log.info("Executing booking job: jobId={}, courtId={}, desiredTime={}",
                jobId, job.courtId().getCode(), triggerCalculator.render(job.desiredTime()));

        RetryState retry = retryPolicy.start();
        while (true) {
            AttemptResult result = attempt(job, job.courtId(), retry.attempt());

            switch (result.outcome()) {
                case ACCEPTED:
                    return complete(job, JobStatus.SUCCESS, "Booked court " + result.courtId().getCode());
                case CREDENTIAL_EXPIRED:
                    return complete(job, JobStatus.FAILED, "Credential expired: " + result.reason());
                case REJECTED:
                    if (fallbackToAlternateCourt) {
                        CourtId alternate = job.courtId().alternate();
                        AttemptResult fallback = attempt(job, alternate, retry.attempt());
                        if (fallback.outcome() == AttemptOutcome.ACCEPTED) {
                            return complete(job, JobStatus.SUCCESS,
                                    "Booked alternate court " + alternate.getCode() + " after rejection");
                        }
                    }
                    return complete(job, JobStatus.FAILED, "Rejected: " + result.reason());
                default:
                    break;
            }

            if (!retry.hasNext()) {
                log.warn("Retry budget exhausted: jobId={}, attempts={}", jobId, retry.attempt());
                return complete(job, JobStatus.FAILED,
                        String.format("Gave up after %d attempts: %s", retry.attempt(), result.reason()));
            }

            try {
                log.debug("Backing off before retry: jobId={}, delay={}", jobId, retry.nextDelay());
                sleeper.sleep(retry.nextDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Execution interrupted during backoff, job stays pending: jobId={}", jobId);
                return ExecutionOutcome.INTERRUPTED;
            }
            retry = retry.next();
        }
    }

    private AttemptResult attempt(Job job, CourtId courtId, int attemptNumber) {
        AttemptResult result;
        try {
            String accessToken = getAccessTokenUseCase.getValidAccessToken();
            ZonedDateTime start = triggerCalculator.toCourtTime(job.desiredTime());
            ZonedDateTime end = triggerCalculator.toCourtTime(job.endTime());
            submit(new ReservationRequest(job.id(), courtId, start, end), accessToken);
            result = new AttemptResult(AttemptOutcome.ACCEPTED, courtId, null);
        } catch (DefinitiveRejectionException e) {
            result = new AttemptResult(AttemptOutcome.REJECTED, courtId, e.getMessage());
        } catch (CredentialExpiredException e) {
            result = new AttemptResult(AttemptOutcome.CREDENTIAL_EXPIRED, courtId, e.getMessage());
        } catch (TransientExecutionException e) {
            result = new AttemptResult(AttemptOutcome.TRANSIENT, courtId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error during booking attempt: jobId={}, attempt={}", job.id(), attemptNumber, e);
            result = new AttemptResult(AttemptOutcome.TRANSIENT, courtId, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        log.info("Booking attempt finished: jobId={}, attempt={}, courtId={}, outcome={}, reason={}",
                job.id(), attemptNumber, courtId.getCode(), result.outcome(), result.reason());
        Counter.builder(ATTEMPT_METRIC)
                .description("예약 제출 시도 수")
                .tag("outcome", result.outcome().name().toLowerCase(Locale.ROOT))
                .tag("court", courtId.getCode())
                .register(meterRegistry)
                .increment();
        return result;
    }

    /**
     * 예약 API가 토큰을 401로 거부하면 캐시된 토큰을 폐기하도록 알린다 (토큰 확보 단계의 만료와 구분)
     */
    private void submit(ReservationRequest request, String accessToken) {
        try {
            courtReservationClient.submit(request, accessToken);
        } catch (CredentialExpiredException e) {
            getAccessTokenUseCase.invalidateAccessToken(accessToken, e.getMessage());
            throw e;
        }
        getAccessTokenUseCase.confirmAccessToken();
    }

    /**
     * PENDING에서 최종 상태로 전이
     * 충돌이면 다른 쪽(취소 등)이 먼저 바꾼 것이므로 새로 읽어 기록만 남긴다.
     */
    private ExecutionOutcome complete(Job job, JobStatus status, String reason) {
        try {
            jobRepository.updateStatus(job.id(), status, JobStatus.PENDING, reason);
            log.info("Job completed: jobId={}, status={}, reason={}", job.id(), status, reason);
            return status == JobStatus.SUCCESS ? ExecutionOutcome.SUCCEEDED : ExecutionOutcome.FAILED;
        } catch (JobStatusConflictException e) {
            JobStatus current = jobRepository.findById(job.id()).map(Job::status).orElse(null);
            log.warn("Job changed while executing, outcome discarded: jobId={}, wanted={}, current={}",
                    job.id(), status, current);
            return ExecutionOutcome.CONFLICT;
        }
    }

    private enum AttemptOutcome {
        ACCEPTED,
        REJECTED,
        TRANSIENT,
        CREDENTIAL_EXPIRED
    }

    private record AttemptResult(AttemptOutcome outcome, CourtId courtId, String reason) {
    }
}
