package com.datakeeper.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Computes the fire times of a scheduled job.
 */
public interface FireSchedule {

    /**
     * First fire time strictly after {@code after}.
     *
     * @return Fire time, or empty if the schedule never fires again
     */
    Optional<Instant> nextFireAfter(Instant after);

    /**
     * First fire time for a job registered at {@code now}.
     *
     * @param misfireGrace How late a fire may still run
     */
    default Optional<Instant> firstFire(Instant now, Duration misfireGrace) {
        return nextFireAfter(now);
    }

    /**
     * Short description for logs, e.g. "interval PT2H".
     */
    String describe();
}
