package personal.court.scheduler.booking.domain.model;

import personal.court.scheduler.booking.domain.exception.ConfigurationException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Recurrence Rule (불변)
 * RFC 5545 RRULE의 부분집합: FREQ, INTERVAL, BYDAY, BYHOUR, BYMINUTE, COUNT, UNTIL
 *
 * 모든 검증은 parse 시점에 끝나며, 전개 중에는 예외가 발생하지 않는다.
 */
public record RecurrenceRule(
        String source,
        Frequency frequency,
        int interval,
        List<DayOfWeek> byDay,
        List<Integer> byHour,
        List<Integer> byMinute,
        Integer count,
        Until until) {

    public enum Frequency {
        DAILY,
        WEEKLY
    }

    /**
     * UNTIL 값. 'Z' 접미사가 있으면 UTC, 없으면 코트 시간대 기준 로컬 시각
     */
    public record Until(LocalDateTime dateTime, boolean utc) {

        public ZonedDateTime resolve(ZoneId zone) {
            return utc
                    ? dateTime.atOffset(ZoneOffset.UTC).atZoneSameInstant(zone)
                    : dateTime.atZone(zone);
        }
    }

    private static final Set<String> KNOWN_KEYS =
            Set.of("FREQ", "INTERVAL", "BYDAY", "BYHOUR", "BYMINUTE", "COUNT", "UNTIL");

    private static final Map<String, DayOfWeek> DAY_CODES = Map.of(
            "MO", DayOfWeek.MONDAY,
            "TU", DayOfWeek.TUESDAY,
            "WE", DayOfWeek.WEDNESDAY,
            "TH", DayOfWeek.THURSDAY,
            "FR", DayOfWeek.FRIDAY,
            "SA", DayOfWeek.SATURDAY,
            "SU", DayOfWeek.SUNDAY);

    private static final DateTimeFormatter UNTIL_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter UNTIL_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    public RecurrenceRule {
        byDay = byDay == null ? List.of() : List.copyOf(byDay);
        byHour = byHour == null ? List.of() : List.copyOf(byHour);
        byMinute = byMinute == null ? List.of() : List.copyOf(byMinute);
    }

    /**
     * 규칙 문자열 파싱
     *
     * @param text "FREQ=WEEKLY;BYDAY=MO,WE;BYHOUR=19;COUNT=10" 형식 ("RRULE:" 접두사 허용)
     * @throws ConfigurationException 형식 오류 시 (문제 필드 포함)
     */
    public static RecurrenceRule parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("rrule", "Recurrence rule cannot be empty");
        }
        String body = text.trim();
        if (body.toUpperCase(Locale.ROOT).startsWith("RRULE:")) {
            body = body.substring("RRULE:".length());
        }

        Map<String, String> parts = new LinkedHashMap<>();
        for (String part : body.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq <= 0) {
                throw new ConfigurationException("rrule", "Expected KEY=VALUE but got '" + part + "'");
            }
            String key = part.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            String value = part.substring(eq + 1).trim();
            if (!KNOWN_KEYS.contains(key)) {
                throw new ConfigurationException(key, "Unsupported rule part");
            }
            if (parts.putIfAbsent(key, value) != null) {
                throw new ConfigurationException(key, "Rule part appears more than once");
            }
        }

        Frequency frequency = parseFrequency(parts.get("FREQ"));
        int interval = parts.containsKey("INTERVAL") ? parsePositive("INTERVAL", parts.get("INTERVAL")) : 1;
        List<DayOfWeek> byDay = parts.containsKey("BYDAY") ? parseDays(parts.get("BYDAY")) : List.of();
        List<Integer> byHour = parts.containsKey("BYHOUR")
                ? parseRange("BYHOUR", parts.get("BYHOUR"), 0, 23) : List.of();
        List<Integer> byMinute = parts.containsKey("BYMINUTE")
                ? parseRange("BYMINUTE", parts.get("BYMINUTE"), 0, 59) : List.of();
        Integer count = parts.containsKey("COUNT") ? parsePositive("COUNT", parts.get("COUNT")) : null;
        Until until = parts.containsKey("UNTIL") ? parseUntil(parts.get("UNTIL")) : null;

        if (count != null && until != null) {
            throw new ConfigurationException("COUNT", "COUNT and UNTIL cannot be combined");
        }

        return new RecurrenceRule(text.trim(), frequency, interval, byDay, byHour, byMinute, count, until);
    }

    private static Frequency parseFrequency(String value) {
        if (value == null) {
            throw new ConfigurationException("FREQ", "FREQ is required");
        }
        try {
            return Frequency.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("FREQ", "Only DAILY and WEEKLY are supported: " + value);
        }
    }

    private static int parsePositive(String field, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(field, "Not a number: " + value);
        }
        if (parsed <= 0) {
            throw new ConfigurationException(field, "Must be positive: " + value);
        }
        return parsed;
    }

    private static List<DayOfWeek> parseDays(String value) {
        Set<DayOfWeek> days = new TreeSet<>();
        for (String token : value.split(",")) {
            DayOfWeek day = DAY_CODES.get(token.trim().toUpperCase(Locale.ROOT));
            if (day == null) {
                throw new ConfigurationException("BYDAY", "Unknown day code: " + token);
            }
            days.add(day);
        }
        return new ArrayList<>(days);
    }

    private static List<Integer> parseRange(String field, String value, int min, int max) {
        Set<Integer> seen = new HashSet<>();
        List<Integer> values = new ArrayList<>();
        for (String token : value.split(",")) {
            int parsed;
            try {
                parsed = Integer.parseInt(token.trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(field, "Not a number: " + token);
            }
            if (parsed < min || parsed > max) {
                throw new ConfigurationException(field,
                        String.format("Out of range [%d, %d]: %d", min, max, parsed));
            }
            if (seen.add(parsed)) {
                values.add(parsed);
            }
        }
        Collections.sort(values);
        return values;
    }

    private static Until parseUntil(String value) {
        String text = value.trim();
        boolean utc = text.endsWith("Z") || text.endsWith("z");
        if (utc) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            if (text.length() == 8 && !utc) {
                // 날짜만 주어지면 그날의 마지막 순간까지 포함
                return new Until(LocalDate.parse(text, UNTIL_DATE).atTime(LocalTime.MAX), false);
            }
            return new Until(LocalDateTime.parse(text, UNTIL_DATE_TIME), utc);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("UNTIL", "Expected yyyyMMdd or yyyyMMdd'T'HHmmss[Z]: " + value);
        }
    }
}
