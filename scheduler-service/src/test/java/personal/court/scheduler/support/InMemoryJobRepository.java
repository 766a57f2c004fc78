package personal.court.scheduler.support;

import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.domain.exception.InvalidJobTransitionException;
import personal.court.scheduler.booking.domain.exception.JobNotFoundException;
import personal.court.scheduler.booking.domain.exception.JobStatusConflictException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 테스트용 JobRepository. 상태 변경은 synchronized compare-and-set
 */
public class InMemoryJobRepository implements JobRepository {

    private final Map<Long, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<Job> findById(Long jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Optional<Job> insertIfAbsent(Job job) {
        boolean exists = jobs.values().stream().anyMatch(existing -> existing.dedupKey().equals(job.dedupKey()));
        if (exists) {
            return Optional.empty();
        }
        Long id = sequence.incrementAndGet();
        Job saved = new Job(id, job.kind(), job.desiredTime(), job.triggerTime(), job.courtId(),
                job.durationMinutes(), job.recurrenceRule(), job.status(), job.statusReason(),
                Instant.EPOCH, Instant.EPOCH);
        jobs.put(id, saved);
        return Optional.of(saved);
    }

    @Override
    public List<Job> findPendingBefore(Instant cutoff) {
        return pendingSorted().stream()
                .filter(job -> job.triggerTime().isBefore(cutoff))
                .collect(Collectors.toList());
    }

    @Override
    public List<Job> findAllPending() {
        return pendingSorted();
    }

    @Override
    public List<Job> search(JobStatus status, CourtId courtId, int offset, int limit) {
        return jobs.values().stream()
                .filter(job -> status == null || job.status() == status)
                .filter(job -> courtId == null || job.courtId() == courtId)
                .sorted(Comparator.comparing(Job::desiredTime).reversed())
                .skip(offset)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<Job> findPendingDesiredBetween(Instant from, Instant to) {
        return jobs.values().stream()
                .filter(Job::isPending)
                .filter(job -> !job.desiredTime().isBefore(from) && job.desiredTime().isBefore(to))
                .sorted(Comparator.comparing(Job::desiredTime))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Job> findNextPendingDesiredAfter(Instant now) {
        return jobs.values().stream()
                .filter(Job::isPending)
                .filter(job -> job.desiredTime().isAfter(now))
                .min(Comparator.comparing(Job::desiredTime));
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        jobs.values().forEach(job -> counts.merge(job.status(), 1L, Long::sum));
        return counts;
    }

    @Override
    public synchronized Job updateStatus(Long jobId, JobStatus newStatus, JobStatus expectedStatus, String reason) {
        Job current = jobs.get(jobId);
        if (current == null) {
            throw new JobNotFoundException(jobId);
        }
        if (current.status() != expectedStatus) {
            throw new JobStatusConflictException(jobId, expectedStatus, current.status());
        }
        Job updated = new Job(current.id(), current.kind(), current.desiredTime(), current.triggerTime(),
                current.courtId(), current.durationMinutes(), current.recurrenceRule(), newStatus, reason,
                current.createdAt(), Instant.EPOCH);
        jobs.put(jobId, updated);
        return updated;
    }

    @Override
    public Job cancel(Long jobId) {
        try {
            return updateStatus(jobId, JobStatus.CANCELLED, JobStatus.PENDING, "Cancelled by user");
        } catch (JobStatusConflictException e) {
            throw new InvalidJobTransitionException(jobId, e.getCurrentStatus());
        }
    }

    private List<Job> pendingSorted() {
        return jobs.values().stream()
                .filter(Job::isPending)
                .sorted(Comparator.comparing(Job::triggerTime).thenComparing(Job::id))
                .collect(Collectors.toList());
    }
}
