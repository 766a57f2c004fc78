package personal.court.scheduler.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.court.scheduler.booking.application.port.in.BookingIntent;
import personal.court.scheduler.booking.application.port.in.IntentLoadReport;
import personal.court.scheduler.booking.application.port.in.LoadIntentsUseCase;
import personal.court.scheduler.booking.application.port.out.JobRepository;
import personal.court.scheduler.booking.application.port.out.TriggerSchedulerPort;
import personal.court.scheduler.booking.domain.exception.ConfigurationException;
import personal.court.scheduler.booking.domain.model.CourtId;
import personal.court.scheduler.booking.domain.model.Job;
import personal.court.scheduler.booking.domain.model.JobKind;
import personal.court.scheduler.booking.domain.model.RecurrenceRule;
import personal.court.scheduler.booking.domain.service.RecurrenceExpander;
import personal.court.scheduler.booking.domain.service.TriggerCalculator;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Intent Load Service
 * 예약 의도를 작업으로 전개해 저장하고 스케줄러에 등록
 *
 * - 같은 의도를 다시 적재해도 (court, desiredTime, rule) 기준으로 중복 생성되지 않는다.
 * - 잘못된 의도는 해당 건만 거부되고 나머지는 계속 처리된다.
 * - 반복 의도는 저장 전에 전부 전개되므로 규칙 오류로 일부만 저장되는 일은 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentLoadService implements LoadIntentsUseCase {

    private static final int DEFAULT_DURATION_MINUTES = 60;
    private static final DateTimeFormatter DESIRED_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter();

    private final JobRepository jobRepository;
    private final TriggerSchedulerPort triggerSchedulerPort;
    private final RecurrenceExpander recurrenceExpander;
    private final TriggerCalculator triggerCalculator;
    private final Clock clock;

    @Override
    public IntentLoadReport load(List<BookingIntent> intents) {
        int created = 0;
        int duplicates = 0;
        int rejected = 0;
        List<Long> createdJobIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Instant now = clock.instant();

        for (int index = 0; index < intents.size(); index++) {
            BookingIntent intent = intents.get(index);
            List<Job> jobs;
            try {
                jobs = toJobs(intent);
            } catch (ConfigurationException e) {
                rejected++;
                errors.add(String.format("intent[%d]: %s", index, e.getMessage()));
                log.warn("Booking intent rejected: index={}, field={}, reason={}", index, e.getField(), e.getMessage());
                continue;
            }

            for (Job job : jobs) {
                var saved = jobRepository.insertIfAbsent(job);
                if (saved.isEmpty()) {
                    duplicates++;
                    continue;
                }
                Job inserted = saved.get();
                created++;
                createdJobIds.add(inserted.id());
                if (inserted.triggerTime().isBefore(now)) {
                    log.warn("Trigger time already passed, job fires immediately: jobId={}, triggerTime={}",
                            inserted.id(), triggerCalculator.render(inserted.triggerTime()));
                }
                triggerSchedulerPort.arm(inserted);
            }
        }

        log.info("Booking intents loaded: intents={}, created={}, duplicates={}, rejected={}",
                intents.size(), created, duplicates, rejected);
        return new IntentLoadReport(intents.size(), created, duplicates, rejected,
                List.copyOf(createdJobIds), List.copyOf(errors));
    }

    private List<Job> toJobs(BookingIntent intent) {
        JobKind kind = parseKind(intent.kind());
        CourtId courtId = intent.courtId() == null || intent.courtId().isBlank()
                ? CourtId.COURT_1
                : CourtId.fromCode(intent.courtId().trim());
        int duration = intent.durationMinutes() == null ? DEFAULT_DURATION_MINUTES : intent.durationMinutes();
        if (duration <= 0) {
            throw new ConfigurationException("duration", "Must be positive: " + duration);
        }

        if (kind == JobKind.SINGLE) {
            if (intent.desiredTime() == null || intent.desiredTime().isBlank()) {
                throw new ConfigurationException("desired_time", "Required for one-off bookings");
            }
            Instant desired = parseDesiredTime(intent.desiredTime()).toInstant();
            return List.of(Job.create(JobKind.SINGLE, desired, courtId, duration, null));
        }

        if (intent.recurrenceRule() == null || intent.recurrenceRule().isBlank()) {
            throw new ConfigurationException("rrule", "Required for recurring bookings");
        }
        RecurrenceRule rule = RecurrenceRule.parse(intent.recurrenceRule());
        ZonedDateTime anchor = intent.desiredTime() == null || intent.desiredTime().isBlank()
                ? LocalDate.now(clock.withZone(triggerCalculator.courtZone())).atStartOfDay(triggerCalculator.courtZone())
                : parseDesiredTime(intent.desiredTime());

        List<Job> jobs = new ArrayList<>();
        for (ZonedDateTime occurrence : recurrenceExpander.expand(anchor, rule)) {
            jobs.add(Job.create(JobKind.RECURRING_INSTANCE, occurrence.toInstant(), courtId, duration, rule.source()));
        }
        if (jobs.isEmpty()) {
            log.warn("Recurrence rule produced no occurrences: rrule={}, anchor={}", rule.source(), anchor);
        }
        return jobs;
    }

    private static JobKind parseKind(String kind) {
        if (kind == null) {
            throw new ConfigurationException("type", "Booking type is required");
        }
        switch (kind.trim().toLowerCase(Locale.ROOT)) {
            case "one-off":
            case "single":
                return JobKind.SINGLE;
            case "recurring":
                return JobKind.RECURRING_INSTANCE;
            default:
                throw new ConfigurationException("type", "Expected one-off or recurring: " + kind);
        }
    }

    /**
     * offset이 있으면 그대로, 없으면 코트 시간대의 벽시계 시각으로 해석
     */
    private ZonedDateTime parseDesiredTime(String text) {
        try {
            TemporalAccessor parsed = DESIRED_TIME.parseBest(text.trim(), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.atZoneSameInstant(triggerCalculator.courtZone());
            }
            return ((LocalDateTime) parsed).atZone(triggerCalculator.courtZone());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("desired_time", "Unrecognized date-time: " + text);
        }
    }
}
