package personal.court.scheduler.booking.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.court.scheduler.booking.application.port.in.ExecutionOutcome;
import personal.court.scheduler.booking.application.port.out.CourtReservationClient;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.ReservationRequest;
import personal.court.scheduler.booking.domain.exception.DefinitiveRejectionException;
import personal.court.scheduler.booking.domain.exception.JobStatusConflictException;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobKind;
import personal.court.scheduler.booking.domain.model.JobStatus;
import personal.court.scheduler.booking.domain.model.RetryPolicy;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;
import personal.court.scheduler.config.CourtSchedulerProperties;
import personal.court.scheduler.credential.application.port.in.GetAccessTokenUseCase;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutionService 단위 테스트")
class JobExecutionServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final Long JOB_ID = 7L;
    private static final String TOKEN = "access-token";

    @Mock
    private JobRepository jobRepository;

    @Mock
    private CourtReservationClient courtReservationClient;

    @Mock
    private GetAccessTokenUseCase getAccessTokenUseCase;

    private SimpleMeterRegistry meterRegistry;
    private List<Duration> sleeps;
    private Job pendingJob;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sleeps = new ArrayList<>();
        pendingJob = jobWithStatus(JobStatus.PENDING);
    }

    private JobExecutionService service(boolean fallbackToAlternateCourt) {
        CourtSchedulerProperties properties = new CourtSchedulerProperties(
                NEW_YORK,
                null,
                new CourtSchedulerProperties.Execution(3, Duration.ofSeconds(2), Duration.ofSeconds(30),
                        fallbackToAlternateCourt),
                null,
                null);
        return new JobExecutionService(
                jobRepository,
                courtReservationClient,
                getAccessTokenUseCase,
                new TriggerCalculator(NEW_YORK),
                new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30)),
                sleeps::add,
                meterRegistry,
                properties);
    }

    private Job jobWithStatus(JobStatus status) {
        Instant desired = Instant.parse("2026-05-01T23:00:00Z");
        return new Job(JOB_ID, JobKind.SINGLE, desired, TriggerCalculator.triggerFor(desired),
                CourtId.COURT_1, 60, null, status, null, Instant.EPOCH, Instant.EPOCH);
    }

    private double attempts(String outcome) {
        Counter counter = meterRegistry.find("court.booking.attempts").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("예약이 접수되면 SUCCESS로 기록한다")
    void execute_Accepted() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.SUCCEEDED);
        ArgumentCaptor<ReservationRequest> captor = ArgumentCaptor.forClass(ReservationRequest.class);
        verify(courtReservationClient).submit(captor.capture(), eq(TOKEN));
        assertThat(captor.getValue().start().getZone()).isEqualTo(NEW_YORK);
        assertThat(captor.getValue().start().getHour()).isEqualTo(19);
        assertThat(captor.getValue().end().getHour()).isEqualTo(20);
        verify(jobRepository).updateStatus(eq(JOB_ID), eq(JobStatus.SUCCESS), eq(JobStatus.PENDING), anyString());
        assertThat(attempts("accepted")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
        verify(getAccessTokenUseCase).confirmAccessToken();
    }

    @Test
    @DisplayName("일시적 실패가 계속되면 정확히 3번 시도 후 FAILED로 기록한다")
    void execute_TransientExhausted() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new TransientExecutionException("HTTP 503"))
                .given(courtReservationClient).submit(any(), anyString());

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED);
        verify(courtReservationClient, times(3)).submit(any(), anyString());
        assertThat(attempts("transient")).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
        verify(jobRepository).updateStatus(eq(JOB_ID), eq(JobStatus.FAILED), eq(JobStatus.PENDING),
                contains("3 attempts"));
    }

    @Test
    @DisplayName("일시적 실패 후 재시도에서 접수되면 SUCCESS")
    void execute_TransientThenAccepted() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new TransientExecutionException("timeout"))
                .willDoNothing()
                .given(courtReservationClient).submit(any(), anyString());

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.SUCCEEDED);
        assertThat(attempts("transient")).isEqualTo(1);
        assertThat(attempts("accepted")).isEqualTo(1);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    @DisplayName("확정 거절이면 재시도하지 않고 FAILED")
    void execute_Rejected() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new DefinitiveRejectionException("slot unavailable"))
                .given(courtReservationClient).submit(any(), anyString());

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED);
        verify(courtReservationClient, times(1)).submit(any(), anyString());
        verify(jobRepository).updateStatus(eq(JOB_ID), eq(JobStatus.FAILED), eq(JobStatus.PENDING),
                contains("slot unavailable"));
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("거절 시 대체 코트 옵션이 켜져 있으면 다른 코트로 한 번 더 시도한다")
    void execute_RejectedThenAlternate() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new DefinitiveRejectionException("slot unavailable"))
                .willDoNothing()
                .given(courtReservationClient).submit(any(), anyString());

        // when
        ExecutionOutcome outcome = service(true).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.SUCCEEDED);
        ArgumentCaptor<ReservationRequest> captor = ArgumentCaptor.forClass(ReservationRequest.class);
        verify(courtReservationClient, times(2)).submit(captor.capture(), anyString());
        assertThat(captor.getAllValues()).extracting(ReservationRequest::courtId)
                .containsExactly(CourtId.COURT_1, CourtId.COURT_2);
    }

    @Test
    @DisplayName("인증이 만료되면 예약 API를 호출하지 않고 FAILED")
    void execute_CredentialExpired() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken())
                .willThrow(new CredentialExpiredException("refresh token expired"));

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED);
        verify(courtReservationClient, never()).submit(any(), anyString());
        verify(jobRepository).updateStatus(eq(JOB_ID), eq(JobStatus.FAILED), eq(JobStatus.PENDING),
                contains("Credential expired"));
        assertThat(attempts("credential_expired")).isEqualTo(1);
        verify(getAccessTokenUseCase, never()).invalidateAccessToken(anyString(), anyString());
    }

    @Test
    @DisplayName("예약 API가 토큰을 401로 거부하면 캐시된 토큰을 폐기시키고 FAILED")
    void execute_AccessTokenRejectedByBookingApi() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new CredentialExpiredException("Booking API rejected access token (401)"))
                .given(courtReservationClient).submit(any(), eq(TOKEN));

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.FAILED);
        verify(getAccessTokenUseCase).invalidateAccessToken(TOKEN, "Booking API rejected access token (401)");
        verify(getAccessTokenUseCase, never()).confirmAccessToken();
        verify(courtReservationClient, times(1)).submit(any(), anyString());
    }

    @Test
    @DisplayName("PENDING이 아닌 작업은 건너뛴다")
    void execute_NotPending() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(jobWithStatus(JobStatus.CANCELLED)));

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.SKIPPED);
        verify(getAccessTokenUseCase, never()).getValidAccessToken();
        verify(jobRepository, never()).updateStatus(any(), any(), any(), any());
    }

    @Test
    @DisplayName("존재하지 않는 작업은 건너뛴다")
    void execute_Absent() {
        // given
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.empty());

        // when & then
        assertThat(service(false).execute(JOB_ID)).isEqualTo(ExecutionOutcome.SKIPPED);
    }

    @Test
    @DisplayName("실행 중 취소되어 상태 변경이 충돌하면 결과를 버린다")
    void execute_Conflict() {
        // given
        given(jobRepository.findById(JOB_ID))
                .willReturn(Optional.of(pendingJob))
                .willReturn(Optional.of(jobWithStatus(JobStatus.CANCELLED)));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        given(jobRepository.updateStatus(eq(JOB_ID), eq(JobStatus.SUCCESS), eq(JobStatus.PENDING), anyString()))
                .willThrow(new JobStatusConflictException(JOB_ID, JobStatus.PENDING, JobStatus.CANCELLED));

        // when
        ExecutionOutcome outcome = service(false).execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.CONFLICT);
        verify(jobRepository, times(2)).findById(JOB_ID);
    }

    @Test
    @DisplayName("backoff 중 인터럽트되면 작업은 PENDING으로 남는다")
    void execute_InterruptedDuringBackoff() {
        // given
        CourtSchedulerProperties properties = new CourtSchedulerProperties(NEW_YORK, null,
                new CourtSchedulerProperties.Execution(3, Duration.ofSeconds(2), Duration.ofSeconds(30), false),
                null, null);
        JobExecutionService interrupting = new JobExecutionService(jobRepository, courtReservationClient,
                getAccessTokenUseCase, new TriggerCalculator(NEW_YORK),
                new RetryPolicy(3, Duration.ofSeconds(2), 2.0, Duration.ofSeconds(30)),
                duration -> {
                    throw new InterruptedException("shutdown");
                },
                meterRegistry, properties);
        given(jobRepository.findById(JOB_ID)).willReturn(Optional.of(pendingJob));
        given(getAccessTokenUseCase.getValidAccessToken()).willReturn(TOKEN);
        willThrow(new TransientExecutionException("HTTP 502"))
                .given(courtReservationClient).submit(any(), anyString());

        // when
        ExecutionOutcome outcome = interrupting.execute(JOB_ID);

        // then
        assertThat(outcome).isEqualTo(ExecutionOutcome.INTERRUPTED);
        assertThat(Thread.interrupted()).isTrue();
        verify(jobRepository, never()).updateStatus(any(), any(), any(), any());
    }
}
