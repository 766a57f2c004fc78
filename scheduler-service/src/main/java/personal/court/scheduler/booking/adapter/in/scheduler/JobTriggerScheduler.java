package personal.court.scheduler.booking.adapter.in.scheduler;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import personal.court.scheduler.booking.application.port.in.ExecuteJobUseCase;
import personal.court.scheduler.booking.application.port.in.ExecutionOutcome;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort;
import personal.court.scheduler.booking.domain.exception.JobStoreUnavailableException;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.config.CourtSchedulerProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Job Trigger Scheduler
 * 전용 스레드 하나가 가장 가까운 트리거 시각까지 잠들었다가 도래한 작업을 워커 풀로 넘긴다.
 *
 * - 시작 시 저장소의 모든 PENDING 작업을 등록 (이미 지난 트리거는 즉시 실행)
 * - 트리거 순(같으면 ID 순)으로 꺼내며, 실행 중인 작업은 다시 dispatch하지 않는다 (중단된 작업은 재등록)
 * - 대기는 maxSleep으로 잘라 벽시계를 다시 확인 (프로세스 일시정지, 시계 보정 대응)
 * - dispatch 후 저장소를 다시 조회해 등록되지 않은 이른 작업을 보충
 * - 저장소 접근 불가는 치명 오류로 루프를 멈추고 SchedulerFailureHandler에 위임
 */
@Slf4j
@Component
public class JobTriggerScheduler implements TriggerSchedulerPort, SmartLifecycle {

    private static final Comparator<ArmedTrigger> TRIGGER_ORDER = Comparator
            .comparing(ArmedTrigger::triggerTime)
            .thenComparing(ArmedTrigger::jobId);

    private final JobRepository jobRepository;
    private final ExecuteJobUseCase executeJobUseCase;
    private final TaskExecutor jobExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final SchedulerFailureHandler failureHandler;
    private final Duration maxSleep;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<ArmedTrigger> wakeSet = new PriorityQueue<>(TRIGGER_ORDER);
    private final Set<Long> armedIds = new HashSet<>();
    private final Set<Long> dispatchedIds = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean failed = new AtomicBoolean(false);

    private volatile boolean running;
    private Thread loopThread;

    public JobTriggerScheduler(JobRepository jobRepository,
                               ExecuteJobUseCase executeJobUseCase,
                               TaskExecutor jobExecutor,
                               Clock clock,
                               MeterRegistry meterRegistry,
                               SchedulerFailureHandler failureHandler,
                               CourtSchedulerProperties properties) {
        this.jobRepository = jobRepository;
        this.executeJobUseCase = executeJobUseCase;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.failureHandler = failureHandler;
        this.maxSleep = properties.scheduler().maxSleep();
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        List<Job> pending = jobRepository.findAllPending();
        Instant now = clock.instant();
        int overdue = 0;
        for (Job job : pending) {
            if (job.triggerTime().isBefore(now)) {
                overdue++;
                log.warn("Overdue trigger, firing immediately: jobId={}, triggerTime={}, desiredTime={}",
                        job.id(), job.triggerTime(), job.desiredTime());
            }
            enqueue(job);
        }

        Gauge.builder("court.scheduler.armed", this, JobTriggerScheduler::armedCount)
                .description("트리거 대기 중인 작업 수")
                .register(meterRegistry);

        running = true;
        loopThread = new Thread(this::runLoop, "job-trigger-loop");
        loopThread.start();
        log.info("Trigger scheduler started: pending={}, overdue={}", pending.size(), overdue);
    }

    @Override
    public void stop() {
        running = false;
        signal();
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(Duration.ofSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Trigger scheduler stopped: armed={}", armedCount());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void arm(Job job) {
        if (enqueue(job)) {
            log.debug("Trigger armed: jobId={}, triggerTime={}", job.id(), job.triggerTime());
        }
    }

    @Override
    public void disarm(Long jobId) {
        lock.lock();
        try {
            if (armedIds.remove(jobId)) {
                wakeSet.removeIf(trigger -> trigger.jobId().equals(jobId));
                changed.signalAll();
                log.debug("Trigger disarmed: jobId={}", jobId);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SchedulerSnapshot snapshot() {
        lock.lock();
        try {
            List<ArmedTrigger> armed = new ArrayList<>(wakeSet);
            armed.sort(TRIGGER_ORDER);
            Thread thread = loopThread;
            boolean alive = running && thread != null && thread.isAlive();
            return new SchedulerSnapshot(alive, List.copyOf(armed));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기 중인 루프를 깨워 시계를 다시 확인하게 한다.
     */
    public void wakeUp() {
        signal();
    }

    private boolean enqueue(Job job) {
        if (!job.isPending()) {
            return false;
        }
        lock.lock();
        try {
            if (dispatchedIds.contains(job.id()) || !armedIds.add(job.id())) {
                return false;
            }
            wakeSet.add(new ArmedTrigger(job.id(), job.triggerTime()));
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void runLoop() {
        while (running) {
            try {
                List<Long> due = awaitDue();
                for (Long jobId : due) {
                    dispatch(jobId);
                }
                if (!due.isEmpty()) {
                    recheckStore();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                if (isStoreUnavailable(e)) {
                    fatal(e);
                    return;
                }
                log.error("Trigger loop iteration failed, continuing: error={}", e.getMessage(), e);
            }
        }
    }

    /**
     * 도래한 트리거가 생길 때까지 대기 후 꺼낸다 (트리거 순)
     */
    private List<Long> awaitDue() throws InterruptedException {
        lock.lock();
        try {
            while (running) {
                Instant now = clock.instant();
                ArmedTrigger head = wakeSet.peek();
                if (head != null && !head.triggerTime().isAfter(now)) {
                    List<Long> due = new ArrayList<>();
                    while (head != null && !head.triggerTime().isAfter(now)) {
                        wakeSet.poll();
                        armedIds.remove(head.jobId());
                        due.add(head.jobId());
                        head = wakeSet.peek();
                    }
                    return due;
                }

                long waitNanos = maxSleep.toNanos();
                if (head != null) {
                    waitNanos = Math.min(waitNanos, Duration.between(now, head.triggerTime()).toNanos());
                }
                changed.awaitNanos(waitNanos);
            }
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(Long jobId) {
        if (!dispatchedIds.add(jobId)) {
            log.debug("Job already dispatched in this process, skipping: jobId={}", jobId);
            return;
        }
        log.info("Trigger fired: jobId={}", jobId);
        jobExecutor.execute(() -> fire(jobId));
    }

    private void fire(Long jobId) {
        try {
            Optional<Job> job = jobRepository.findById(jobId);
            if (job.isEmpty() || !job.get().isPending()) {
                log.info("Fired job is no longer pending, no-op: jobId={}, status={}",
                        jobId, job.map(j -> j.status().name()).orElse("ABSENT"));
                dispatchedIds.remove(jobId);
                return;
            }
            ExecutionOutcome outcome = executeJobUseCase.execute(jobId);
            log.info("Job execution finished: jobId={}, outcome={}", jobId, outcome);
            release(job.get(), outcome);
        } catch (RuntimeException e) {
            if (isStoreUnavailable(e)) {
                fatal(e);
                return;
            }
            log.error("Job execution failed unexpectedly: jobId={}", jobId, e);
        }
    }

    /**
     * 실행이 끝난 작업의 dispatch 표식 해제
     * 중단(INTERRUPTED)된 작업은 PENDING으로 남으므로 루프가 살아 있으면 바로 다시 등록한다.
     * 예기치 못한 오류로 끝난 작업은 표식을 유지해 같은 오류로 반복 실행되지 않게 한다.
     */
    private void release(Job job, ExecutionOutcome outcome) {
        dispatchedIds.remove(job.id());
        if (outcome != ExecutionOutcome.INTERRUPTED) {
            return;
        }
        if (!running) {
            log.warn("Interrupted job left pending for next start: jobId={}", job.id());
            return;
        }
        if (enqueue(job)) {
            log.warn("Interrupted job re-armed: jobId={}, triggerTime={}", job.id(), job.triggerTime());
        }
    }

    /**
     * 다음 대기 트리거보다 이른 PENDING 작업 중 등록되지 않은 것을 보충
     */
    private void recheckStore() {
        Instant nextWakeup;
        lock.lock();
        try {
            ArmedTrigger head = wakeSet.peek();
            nextWakeup = head == null ? null : head.triggerTime();
        } finally {
            lock.unlock();
        }

        List<Job> candidates = nextWakeup == null
                ? jobRepository.findAllPending()
                : jobRepository.findPendingBefore(nextWakeup);
        for (Job job : candidates) {
            if (enqueue(job)) {
                log.info("Unarmed pending job found on recheck: jobId={}, triggerTime={}", job.id(), job.triggerTime());
            }
        }
    }

    private void fatal(Throwable cause) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        running = false;
        signal();
        log.error("Trigger scheduler halted: job store unavailable");
        failureHandler.onFatal(cause);
    }

    private void signal() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private int armedCount() {
        lock.lock();
        try {
            return armedIds.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 저장소 어댑터가 연결/트랜잭션 장애를 JobStoreUnavailableException으로 바꿔 던진다.
     */
    static boolean isStoreUnavailable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof JobStoreUnavailableException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
