package com.datakeeper.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires once, at a fixed time.
 */
public class DateSchedule implements FireSchedule {

    private final Instant runAt;

    public DateSchedule(Instant runAt) {
        this.runAt = runAt;
    }

    @Override
    public Optional<Instant> nextFireAfter(Instant after) {
        return runAt.isAfter(after) ? Optional.of(runAt) : Optional.empty();
    }

    /**
     * A run time in the past still fires if it is within the misfire grace.
     */
    @Override
    public Optional<Instant> firstFire(Instant now, Duration misfireGrace) {
        return nextFireAfter(now.minus(misfireGrace));
    }

    public Instant getRunAt() {
        return runAt;
    }

    @Override
    public String describe() {
        return "date " + runAt;
    }
}
