package personal.court.scheduler.booking.domain.service;

import personal.court.scheduler.booking.domain.model.RecurrenceRule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Recurrence Expander
 * 반복 규칙과 기준 시각으로부터 발생 시각 목록을 전개
 *
 * - 결과는 지연 평가되며 iterator()를 호출할 때마다 처음부터 다시 전개된다.
 * - 발생 시각은 기준 시각의 시간대에서 벽시계 시/분을 유지한다 (DST 전환 시에도 19:00은 19:00).
 * - COUNT 또는 UNTIL로 제한되며, 어떤 경우에도 MAX_OCCURRENCES개를 넘지 않는다.
 * - 기준 시각 이전의 발생은 만들지 않는다.
 */
public class RecurrenceExpander {

    public static final int MAX_OCCURRENCES = 52;

    // 발생이 하나도 없는 주기를 연속으로 이만큼 지나면 전개 종료
    private static final int MAX_EMPTY_PERIODS = 5_000;

    public Occurrences expand(ZonedDateTime anchor, RecurrenceRule rule) {
        if (anchor == null || rule == null) {
            throw new IllegalArgumentException("Anchor and rule cannot be null");
        }
        return new Occurrences(anchor, rule);
    }

    /**
     * 전개 결과 (재시작 가능한 유한 시퀀스)
     */
    public static final class Occurrences implements Iterable<ZonedDateTime> {

        private final ZonedDateTime anchor;
        private final RecurrenceRule rule;

        private Occurrences(ZonedDateTime anchor, RecurrenceRule rule) {
            this.anchor = anchor;
            this.rule = rule;
        }

        @Override
        public Iterator<ZonedDateTime> iterator() {
            return new OccurrenceIterator(anchor, rule);
        }

        public List<ZonedDateTime> toList() {
            List<ZonedDateTime> result = new ArrayList<>();
            for (ZonedDateTime occurrence : this) {
                result.add(occurrence);
            }
            return result;
        }
    }

    private static final class OccurrenceIterator implements Iterator<ZonedDateTime> {

        private final ZonedDateTime anchor;
        private final RecurrenceRule rule;
        private final List<DayOfWeek> days;
        private final List<Integer> hours;
        private final List<Integer> minutes;
        private final ZonedDateTime until;
        private final int limit;
        private final LocalDate firstPeriodStart;

        private final Deque<ZonedDateTime> buffer = new ArrayDeque<>();
        private long periodIndex;
        private int emitted;
        private ZonedDateTime last;
        private boolean exhausted;

        private OccurrenceIterator(ZonedDateTime anchor, RecurrenceRule rule) {
            this.anchor = anchor;
            this.rule = rule;
            this.days = rule.byDay().isEmpty() && rule.frequency() == RecurrenceRule.Frequency.WEEKLY
                    ? List.of(anchor.getDayOfWeek())
                    : rule.byDay();
            this.hours = rule.byHour().isEmpty() ? List.of(anchor.getHour()) : rule.byHour();
            this.minutes = rule.byMinute().isEmpty() ? List.of(anchor.getMinute()) : rule.byMinute();
            this.until = rule.until() == null ? null : rule.until().resolve(anchor.getZone());
            this.limit = rule.count() == null ? MAX_OCCURRENCES : Math.min(rule.count(), MAX_OCCURRENCES);
            this.firstPeriodStart = rule.frequency() == RecurrenceRule.Frequency.WEEKLY
                    ? anchor.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    : anchor.toLocalDate();
        }

        @Override
        public boolean hasNext() {
            if (emitted >= limit) {
                return false;
            }
            if (!buffer.isEmpty()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            int emptyPeriods = 0;
            while (buffer.isEmpty()) {
                if (emptyPeriods >= MAX_EMPTY_PERIODS) {
                    exhausted = true;
                    return false;
                }
                List<ZonedDateTime> candidates = nextPeriod();
                if (candidates == null) {
                    exhausted = true;
                    return false;
                }
                buffer.addAll(candidates);
                emptyPeriods++;
            }
            return true;
        }

        @Override
        public ZonedDateTime next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ZonedDateTime occurrence = buffer.poll();
            last = occurrence;
            emitted++;
            return occurrence;
        }

        /**
         * 다음 주기의 후보 목록. UNTIL을 넘어서면 null
         */
        private List<ZonedDateTime> nextPeriod() {
            List<LocalDate> dates = datesOf(periodIndex++);
            List<ZonedDateTime> candidates = new ArrayList<>();
            for (LocalDate date : dates) {
                for (int hour : hours) {
                    for (int minute : minutes) {
                        ZonedDateTime candidate = ZonedDateTime.of(date, LocalTime.of(hour, minute), anchor.getZone());
                        if (until != null && candidate.isAfter(until)) {
                            if (candidates.isEmpty()) {
                                return null;
                            }
                            exhausted = true;
                            return candidates;
                        }
                        if (candidate.isBefore(anchor)) {
                            continue;
                        }
                        ZonedDateTime previous = candidates.isEmpty() ? last : candidates.get(candidates.size() - 1);
                        if (previous != null && !candidate.toInstant().isAfter(previous.toInstant())) {
                            continue;
                        }
                        candidates.add(candidate);
                    }
                }
            }
            return candidates;
        }

        private List<LocalDate> datesOf(long index) {
            if (rule.frequency() == RecurrenceRule.Frequency.DAILY) {
                LocalDate date = firstPeriodStart.plusDays(index * rule.interval());
                if (!days.isEmpty() && !days.contains(date.getDayOfWeek())) {
                    return List.of();
                }
                return List.of(date);
            }
            LocalDate weekStart = firstPeriodStart.plusWeeks(index * rule.interval());
            List<LocalDate> dates = new ArrayList<>(days.size());
            for (DayOfWeek day : days) {
                dates.add(weekStart.plusDays(day.getValue() - DayOfWeek.MONDAY.getValue()));
            }
            return dates;
        }
    }
}
