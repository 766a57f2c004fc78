package personal.court.scheduler.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import personal.court.scheduler.booking.application.port.in.ExecuteJobUseCase;
import personal.court.scheduler.booking.application.port.in.ExecutionOutcome;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort.ArmedTrigger;
import personal.court.scheduler.booking.domain.exception.JobStoreUnavailableException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobKind;
import personal.court.scheduler.booking.domain.model.JobStatus;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;
import personal.court.scheduler.config.CourtSchedulerProperties;
import personal.court.scheduler.support.InMemoryJobRepository;
import personal.court.scheduler.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("JobTriggerScheduler 테스트")
class JobTriggerSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private InMemoryJobRepository jobRepository;
    private List<Long> executed;
    private AtomicReference<Throwable> fatal;
    private JobTriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        jobRepository = new InMemoryJobRepository();
        executed = new CopyOnWriteArrayList<>();
        fatal = new AtomicReference<>();
        ExecuteJobUseCase recording = jobId -> {
            executed.add(jobId);
            jobRepository.updateStatus(jobId, JobStatus.SUCCESS, JobStatus.PENDING, "booked");
            return ExecutionOutcome.SUCCEEDED;
        };
        scheduler = newScheduler(recording);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private JobTriggerScheduler newScheduler(ExecuteJobUseCase executeJobUseCase) {
        CourtSchedulerProperties properties = new CourtSchedulerProperties(
                ZoneId.of("America/New_York"),
                new CourtSchedulerProperties.Scheduler(1, Duration.ofMillis(20)),
                null, null, null);
        return new JobTriggerScheduler(jobRepository, executeJobUseCase, new SyncTaskExecutor(), clock,
                new SimpleMeterRegistry(), fatal::set, properties);
    }

    /**
     * 트리거 시각이 T0 + offset인 작업 저장
     */
    private Job storeJob(Duration triggerOffset) {
        Instant desired = T0.plus(triggerOffset).plus(TriggerCalculator.ADVANCE_WINDOW);
        return jobRepository.insertIfAbsent(Job.create(JobKind.SINGLE, desired, CourtId.COURT_1, 60, null))
                .orElseThrow();
    }

    private void advanceTo(Duration offset) {
        clock.set(T0.plus(offset));
        scheduler.wakeUp();
    }

    @Test
    @DisplayName("도래한 작업을 트리거 시각 순서대로 실행한다")
    void firesInTriggerOrder() {
        // given
        Job second = storeJob(Duration.ofHours(2));
        Job first = storeJob(Duration.ofHours(1));
        Job third = storeJob(Duration.ofHours(3));
        scheduler.start();

        // when
        advanceTo(Duration.ofHours(4));

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(executed).containsExactly(first.id(), second.id(), third.id()));
        assertThat(jobRepository.findAllPending()).isEmpty();
    }

    @Test
    @DisplayName("트리거 시각 전에는 실행하지 않는다")
    void doesNotFireEarly() throws InterruptedException {
        // given
        Job job = storeJob(Duration.ofHours(1));
        scheduler.start();

        // when
        advanceTo(Duration.ofMinutes(59));
        Thread.sleep(100);

        // then
        assertThat(executed).isEmpty();
        assertThat(scheduler.snapshot().armed()).extracting(ArmedTrigger::jobId).containsExactly(job.id());

        advanceTo(Duration.ofHours(1));
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(executed).containsExactly(job.id()));
    }

    @Test
    @DisplayName("시작 시 이미 지난 트리거는 즉시 실행한다")
    void firesOverdueOnStart() {
        // given
        Job overdue = storeJob(Duration.ofHours(-2));

        // when
        scheduler.start();

        // then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(executed).containsExactly(overdue.id()));
    }

    @Test
    @DisplayName("취소된 작업은 트리거 시각이 와도 실행하지 않는다")
    void skipsCancelledJobs() {
        // given
        Job disarmed = storeJob(Duration.ofHours(1));
        Job cancelledInStoreOnly = storeJob(Duration.ofHours(2));
        Job sentinel = storeJob(Duration.ofHours(3));
        scheduler.start();

        // when
        jobRepository.cancel(disarmed.id());
        scheduler.disarm(disarmed.id());
        jobRepository.cancel(cancelledInStoreOnly.id());
        advanceTo(Duration.ofHours(4));

        // then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(executed).contains(sentinel.id()));
        assertThat(executed).containsExactly(sentinel.id());
    }

    @Test
    @DisplayName("실행 중에 더 이른 작업이 등록되면 그 작업이 먼저 실행된다")
    void picksUpEarlierInsert() {
        // given
        Job late = storeJob(Duration.ofHours(5));
        scheduler.start();

        // when
        Job early = storeJob(Duration.ofHours(1));
        scheduler.arm(early);
        advanceTo(Duration.ofMinutes(90));

        // then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(executed).containsExactly(early.id()));
        assertThat(scheduler.snapshot().armed()).extracting(ArmedTrigger::jobId).containsExactly(late.id());
    }

    @Test
    @DisplayName("등록되지 않은 PENDING 작업은 dispatch 후 저장소 재확인으로 보충된다")
    void recheckFindsUnarmedJob() {
        // given
        Job armed = storeJob(Duration.ofHours(1));
        scheduler.start();
        Job unarmed = storeJob(Duration.ofMinutes(30));

        // when
        advanceTo(Duration.ofHours(2));

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(executed).containsExactlyInAnyOrder(armed.id(), unarmed.id()));
    }

    @Test
    @DisplayName("실행 중인 작업은 다시 등록해도 중복 dispatch되지 않는다")
    void dispatchesAtMostOnce() throws InterruptedException {
        // given
        CountDownLatch executing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        scheduler = newScheduler(jobId -> {
            executed.add(jobId);
            executing.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            jobRepository.updateStatus(jobId, JobStatus.SUCCESS, JobStatus.PENDING, "booked");
            return ExecutionOutcome.SUCCEEDED;
        });
        Job job = storeJob(Duration.ofHours(1));
        scheduler.start();

        // when
        advanceTo(Duration.ofHours(2));
        assertThat(executing.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.arm(job);

        // then
        assertThat(scheduler.snapshot().armed()).isEmpty();
        release.countDown();
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(jobRepository.findAllPending()).isEmpty());
        Thread.sleep(100);
        assertThat(executed).containsExactly(job.id());
    }

    @Test
    @DisplayName("중단되어 PENDING으로 남은 작업은 다시 등록되어 실행된다")
    void rearmsInterruptedJob() {
        // given: 첫 실행은 중단, 두 번째 실행은 접수
        AtomicInteger calls = new AtomicInteger();
        scheduler = newScheduler(jobId -> {
            executed.add(jobId);
            if (calls.incrementAndGet() == 1) {
                return ExecutionOutcome.INTERRUPTED;
            }
            jobRepository.updateStatus(jobId, JobStatus.SUCCESS, JobStatus.PENDING, "booked");
            return ExecutionOutcome.SUCCEEDED;
        });
        Job job = storeJob(Duration.ofHours(1));
        scheduler.start();

        // when
        advanceTo(Duration.ofHours(2));

        // then
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(executed).containsExactly(job.id(), job.id()));
        assertThat(jobRepository.findAllPending()).isEmpty();
        assertThat(fatal.get()).isNull();
    }

    @Test
    @DisplayName("작업 저장소에 접근할 수 없으면 루프를 멈추고 실패 핸들러를 호출한다")
    void haltsWhenStoreUnavailable() {
        // given
        scheduler = newScheduler(jobId -> {
            throw new JobStoreUnavailableException("database is gone", new IllegalStateException("closed"));
        });
        storeJob(Duration.ofHours(-1));

        // when
        scheduler.start();

        // then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(fatal.get()).isNotNull());
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(scheduler.snapshot().running()).isFalse());
    }

    @Test
    @DisplayName("원인 체인에 저장소 장애가 있으면 치명 오류로 판단한다")
    void isStoreUnavailable() {
        assertThat(JobTriggerScheduler.isStoreUnavailable(new RuntimeException("wrapped",
                new JobStoreUnavailableException("store down", new DataAccessResourceFailureException("io")))))
                .isTrue();
        assertThat(JobTriggerScheduler.isStoreUnavailable(new DataAccessResourceFailureException("untranslated")))
                .isFalse();
        assertThat(JobTriggerScheduler.isStoreUnavailable(new IllegalStateException("other"))).isFalse();
    }
}
