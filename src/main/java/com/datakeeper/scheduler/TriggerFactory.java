package com.datakeeper.scheduler;

import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.exception.ConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Map;

/**
 * Builds fire schedules from schedule trigger specs.
 * <p>
 * Supported specs:
 * <pre>
 * {type: cron, cron: "*&#47;5 * * * *"}
 * {type: interval, unit: hours, value: 2}
 * {type: date, date: "2025-04-12T02:00:00Z"}
 * </pre>
 */
public final class TriggerFactory {

    public static final String CRON = "cron";
    public static final String INTERVAL = "interval";
    public static final String DATE = "date";

    static final String DEFAULT_CRON = "0 0 * * *";
    static final String DEFAULT_INTERVAL_UNIT = "hours";

    private TriggerFactory() {
    }

    /**
     * @param trigger Schedule trigger
     * @param now     Registration time, the start of interval schedules
     * @param zone    Zone for cron expressions and dates without offset
     * @throws ConfigurationException for an unsupported or malformed spec
     */
    public static FireSchedule create(TriggerDefinition trigger, Instant now, ZoneId zone) {
        String type = trigger.scheduleType();
        Map<String, Object> spec = trigger.spec();
        if (type == null) {
            throw new ConfigurationException("Schedule trigger has no type: " + spec);
        }
        try {
            return switch (type.toLowerCase(Locale.ROOT)) {
                case CRON -> new CronSchedule(String.valueOf(spec.getOrDefault("cron", DEFAULT_CRON)), zone);
                case INTERVAL -> new IntervalSchedule(parseInterval(spec), now);
                case DATE -> new DateSchedule(parseDate(spec.get("date"), zone));
                default -> throw new ConfigurationException("Unknown schedule type: " + type);
            };
        } catch (IllegalArgumentException | DateTimeParseException | ArithmeticException e) {
            throw new ConfigurationException("Invalid " + type + " schedule " + spec + ": " + e.getMessage(), e);
        }
    }

    static Duration parseInterval(Map<String, Object> spec) {
        String unit = String.valueOf(spec.getOrDefault("unit", DEFAULT_INTERVAL_UNIT)).toLowerCase(Locale.ROOT);
        Object rawValue = spec.getOrDefault("value", 1);
        long value = rawValue instanceof Number n ? n.longValue() : Long.parseLong(rawValue.toString().trim());
        if (!unit.endsWith("s")) {
            unit = unit + "s";
        }
        ChronoUnit chronoUnit = switch (unit) {
            case "weeks" -> ChronoUnit.WEEKS;
            case "days" -> ChronoUnit.DAYS;
            case "hours" -> ChronoUnit.HOURS;
            case "minutes" -> ChronoUnit.MINUTES;
            case "seconds" -> ChronoUnit.SECONDS;
            default -> throw new IllegalArgumentException("Unknown interval unit: " + unit);
        };
        return chronoUnit.getDuration().multipliedBy(value);
    }

    /**
     * Parse an ISO date-time with offset ("...Z", "...+02:00"), a local date-time (in {@code zone})
     * or a plain date (midnight in {@code zone}). A space may separate date and time.
     */
    static Instant parseDate(Object value, ZoneId zone) {
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("No date specified for date trigger");
        }
        // unquoted YAML timestamps arrive as dates
        if (value instanceof Date date) {
            return date.toInstant();
        }
        String text = value.toString().trim().replace(' ', 'T');
        if (!text.contains("T")) {
            return LocalDate.parse(text).atStartOfDay(zone).toInstant();
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }
}
