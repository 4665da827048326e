package com.datakeeper.scheduler;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Fires on a cron expression, evaluated in a fixed time zone.
 */
public class CronSchedule implements FireSchedule {

    private final CronExpression expression;
    private final String source;
    private final ZoneId zone;

    /**
     * @param source Cron expression with five (crontab) or six (with seconds) fields
     * @throws IllegalArgumentException if the expression is invalid
     */
    public CronSchedule(String source, ZoneId zone) {
        String trimmed = source.trim();
        String[] fields = trimmed.split("\\s+");
        // crontab expressions have no seconds field
        this.expression = CronExpression.parse(fields.length == 5 ? "0 " + trimmed : trimmed);
        this.source = trimmed;
        this.zone = zone;
    }

    @Override
    public Optional<Instant> nextFireAfter(Instant after) {
        ZonedDateTime next = expression.next(ZonedDateTime.ofInstant(after, zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    @Override
    public String describe() {
        return "cron '" + source + "'";
    }
}
