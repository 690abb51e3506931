package com.parley.core.scheduler;

import com.parley.core.model.ScheduleType;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Computes run times for cron, interval and one-shot schedules in a fixed time zone.
 *
 * <p>Cron values use the standard five fields (minute hour day-of-month month day-of-week);
 * six-field values with a leading seconds field are accepted as-is.
 */
public class ScheduleCalculator {

    private final ZoneId zone;

    public ScheduleCalculator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Validates {@code value} and returns the first run time.
     *
     * @throws SchedulingSpecException if the schedule cannot be evaluated
     */
    public Instant firstRun(ScheduleType type, String value, Instant now) {
        if (type == null) {
            throw new SchedulingSpecException("Unknown schedule type");
        }
        return switch (type) {
            case CRON -> nextCron(value, now);
            case INTERVAL -> now.plusMillis(intervalMillis(value));
            case ONCE -> parseTimestamp(value);
        };
    }

    /**
     * Next run after a completed run at {@code now}; null for one-shot schedules.
     */
    public Instant nextRun(ScheduleType type, String value, Instant now) {
        return switch (type) {
            case CRON -> nextCron(value, now);
            case INTERVAL -> now.plusMillis(intervalMillis(value));
            case ONCE -> null;
        };
    }

    public ZoneId zone() {
        return zone;
    }

    Instant nextCron(String value, Instant now) {
        CronExpression cron = parseCron(value);
        ZonedDateTime next = cron.next(now.atZone(zone));
        if (next == null) {
            throw new SchedulingSpecException("Cron expression '" + value + "' never fires");
        }
        return next.toInstant();
    }

    static CronExpression parseCron(String value) {
        if (value == null || value.isBlank()) {
            throw new SchedulingSpecException("Cron expression is empty");
        }
        String trimmed = value.trim();
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new SchedulingSpecException("Invalid cron expression '" + value + "': " + e.getMessage(), e);
        }
    }

    static long intervalMillis(String value) {
        long ms;
        try {
            ms = Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new SchedulingSpecException("Invalid interval '" + value + "', expected milliseconds", e);
        }
        if (ms <= 0) {
            throw new SchedulingSpecException("Interval must be positive, got " + ms);
        }
        return ms;
    }

    /** ISO instant, ISO offset date-time, or local date-time in the configured zone. */
    Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new SchedulingSpecException("Timestamp is empty");
        }
        String trimmed = value.trim();
        List<Function<String, Instant>> parsers = List.of(
                Instant::parse,
                s -> OffsetDateTime.parse(s).toInstant(),
                s -> LocalDateTime.parse(s).atZone(zone).toInstant());
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : parsers) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new SchedulingSpecException("Invalid timestamp '" + value + "'", last);
    }
}
