package personal.court.scheduler.acceptance.steps;

import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.court.scheduler.acceptance.support.BookingTestContext;
import personal.court.scheduler.acceptance.support.SchedulerTestAdapter;
import personal.court.scheduler.booking.application.port.in.ExecutionOutcome;
import personal.court.scheduler.booking.application.port.in.IntentLoadReport;
import personal.court.scheduler.booking.application.port.in.SchedulerAlerts;
import personal.court.scheduler.booking.application.port.out.CourtReservationClient;
import personal.court.scheduler.booking.application.port.out.ReservationRequest;
import personal.court.scheduler.booking.domain.exception.TransientExecutionException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.JobStatus;
import personal.court.scheduler.credential.domain.exception.CredentialExpiredException;
import personal.court.scheduler.credential.domain.model.AlertLevel;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willDoNothing;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 예약 트리거 인수 테스트 Step Definitions
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class BookingAcceptanceSteps {

    private static final ZoneId COURT_ZONE = ZoneId.of("America/New_York");

    private final SchedulerTestAdapter schedulerAdapter;
    private final BookingTestContext context;
    private final CourtReservationClient courtReservationClient;

    // ==========================================
    // 배경: 시계와 저장소
    // ==========================================

    @Given("현재 시각은 {string}이다")
    public void 현재_시각은(String now) {
        log.info(">>> Given: 현재 시각 {}", now);
        schedulerAdapter.resetAt(Instant.parse(now));
    }

    // ==========================================
    // Given: 예약 API 동작
    // ==========================================

    @Given("예약 API가 요청을 접수한다")
    public void 예약_API가_요청을_접수한다() {
        willDoNothing().given(courtReservationClient).submit(any(), anyString());
    }

    @Given("예약 API가 계속 일시적 오류로 응답한다")
    public void 예약_API가_계속_일시적_오류로_응답한다() {
        willThrow(new TransientExecutionException("Booking API returned 503"))
                .given(courtReservationClient).submit(any(), anyString());
    }

    @Given("예약 API가 액세스 토큰을 거부한다")
    public void 예약_API가_액세스_토큰을_거부한다() {
        willThrow(new CredentialExpiredException("Booking API rejected access token (401)"))
                .given(courtReservationClient).submit(any(), anyString());
    }

    @Given("예약 API가 동시 요청 {int}건이 모두 도착할 때까지 응답을 미룬다")
    public void 예약_API가_동시_요청이_모두_도착할_때까지_응답을_미룬다(int requests) {
        CountDownLatch allSubmitting = new CountDownLatch(requests);
        willAnswer(invocation -> {
            allSubmitting.countDown();
            allSubmitting.await(2, TimeUnit.SECONDS);
            return null;
        }).given(courtReservationClient).submit(any(), anyString());
    }

    @And("코트 {string}을 {string}부터 {int}분 사용하는 단건 예약 의도를 적재한다")
    public void 단건_예약_의도를_적재한다(String courtId, String desiredTime, int durationMinutes) {
        log.info(">>> Given: 단건 예약 적재 courtId={}, desiredTime={}", courtId, desiredTime);
        IntentLoadReport report = schedulerAdapter.loadOneOff(courtId, desiredTime, durationMinutes);
        assertThat(report.created()).isEqualTo(1);
        context.setCurrentJobId(report.createdJobIds().get(0));
    }

    // ==========================================
    // When: 시간 경과와 실행
    // ==========================================

    @When("현재 시각이 {string}가 된다")
    public void 현재_시각이_된다(String now) {
        log.info(">>> When: 시계 이동 {}", now);
        schedulerAdapter.moveClockTo(Instant.parse(now));
    }

    @When("같은 작업을 {int}개의 실행이 동시에 실행한다")
    public void 같은_작업을_동시에_실행한다(int executions) throws Exception {
        Long jobId = context.getCurrentJobId();
        ExecutorService executor = Executors.newFixedThreadPool(executions);
        try {
            List<CompletableFuture<ExecutionOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < executions; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> schedulerAdapter.execute(jobId), executor));
            }
            for (CompletableFuture<ExecutionOutcome> future : futures) {
                context.getOutcomes().add(future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @When("반복 규칙 {string}으로 {string}부터 코트 {string} 예약 의도를 두 번 적재한다")
    public void 반복_예약_의도를_두_번_적재한다(String rule, String anchor, String courtId) {
        context.getLoadReports().add(schedulerAdapter.loadRecurring(courtId, anchor, 60, rule));
        context.getLoadReports().add(schedulerAdapter.loadRecurring(courtId, anchor, 60, rule));
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("예약 API는 아직 호출되지 않는다")
    public void 예약_API는_아직_호출되지_않는다() {
        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> verify(courtReservationClient, never()).submit(any(), anyString()));
    }

    @Then("작업은 {string} 상태가 된다")
    public void 작업은_상태가_된다(String status) {
        Long jobId = context.getCurrentJobId();
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(schedulerAdapter.statusOf(jobId)).isEqualTo(JobStatus.valueOf(status)));
    }

    @And("예약 API는 코트 {string}에 현지 시각 {string}부터 {string}까지 요청을 한 번 받는다")
    public void 예약_API는_요청을_한_번_받는다(String courtId, String start, String end) {
        Long jobId = context.getCurrentJobId();
        verify(courtReservationClient, times(1)).submit(argThat((ReservationRequest request) ->
                request.jobId().equals(jobId)
                        && request.courtId() == CourtId.fromCode(courtId)
                        && request.start().getZone().equals(COURT_ZONE)
                        && request.start().toLocalDateTime().equals(LocalDateTime.parse(start))
                        && request.end().toLocalDateTime().equals(LocalDateTime.parse(end))), anyString());
    }

    @And("예약 API는 {int}번 호출된다")
    public void 예약_API는_호출된다(int count) {
        Long jobId = context.getCurrentJobId();
        verify(courtReservationClient, times(count))
                .submit(argThat((ReservationRequest request) -> request.jobId().equals(jobId)), anyString());
    }

    @Then("실행 결과 중 SUCCEEDED는 한 번뿐이고 FAILED는 없다")
    public void 실행_결과는_한_번만_성공한다() {
        assertThat(context.getOutcomes()).containsOnlyOnce(ExecutionOutcome.SUCCEEDED);
        assertThat(context.getOutcomes()).doesNotContain(ExecutionOutcome.FAILED);
    }

    @Then("첫 적재는 작업 {int}건을 만들고 두 번째 적재는 {int}건을 중복으로 건너뛴다")
    public void 재적재는_중복으로_건너뛴다(int created, int duplicates) {
        List<IntentLoadReport> reports = context.getLoadReports();
        assertThat(reports.get(0).created()).isEqualTo(created);
        assertThat(reports.get(1).created()).isZero();
        assertThat(reports.get(1).duplicates()).isEqualTo(duplicates);
    }

    @And("스케줄러 알림 수준은 {string}이다")
    public void 스케줄러_알림_수준은(String level) {
        assertThat(schedulerAdapter.alerts().level()).isEqualTo(AlertLevel.valueOf(level));
    }

    @And("인증 알림 중 하나는 {string}으로 시작한다")
    public void 인증_알림_중_하나는_으로_시작한다(String prefix) {
        assertThat(schedulerAdapter.alerts().alerts())
                .filteredOn(alert -> alert.category().equals("authentication"))
                .extracting(SchedulerAlerts.Alert::message)
                .anyMatch(message -> message.startsWith(prefix));
    }
}
