package com.datakeeper.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires every {@code interval}, starting one interval after {@code start}.
 */
public class IntervalSchedule implements FireSchedule {

    private final Duration interval;
    private final Instant start;

    public IntervalSchedule(Duration interval, Instant start) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive, got " + interval);
        }
        this.interval = interval;
        this.start = start;
    }

    @Override
    public Optional<Instant> nextFireAfter(Instant after) {
        if (after.isBefore(start)) {
            return Optional.of(start.plus(interval));
        }
        long elapsed = Duration.between(start, after).toMillis();
        long periods = elapsed / interval.toMillis() + 1;
        return Optional.of(start.plus(interval.multipliedBy(periods)));
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public String describe() {
        return "interval " + interval;
    }
}
