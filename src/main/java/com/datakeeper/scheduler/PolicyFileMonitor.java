package com.datakeeper.scheduler;

import com.datakeeper.policy.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically checks the policy file and, when it has been modified, reloads the policy
 * store and reschedules every job.
 */
public class PolicyFileMonitor {

    private static final Logger log = LoggerFactory.getLogger(PolicyFileMonitor.class);

    private final PolicyStore policyStore;
    private final JobScheduler jobScheduler;
    private final Duration checkInterval;

    private volatile FileTime lastModified;
    private ScheduledFuture<?> future;

    public PolicyFileMonitor(PolicyStore policyStore, JobScheduler jobScheduler, Duration checkInterval) {
        this.policyStore = policyStore;
        this.jobScheduler = jobScheduler;
        this.checkInterval = checkInterval;
        this.lastModified = currentModificationTime().orElse(null);
    }

    /**
     * Start checking every {@code checkInterval}. Does nothing for a policy file that is not
     * on the filesystem.
     */
    public synchronized void start(TaskScheduler taskScheduler) {
        if (future != null) {
            return;
        }
        if (policyStore.getPolicyFile().isEmpty()) {
            log.info("Policy file {} is not a file, changes are not monitored", policyStore.getPolicyPath());
            return;
        }
        log.info("Monitoring {} for changes every {}", policyStore.getPolicyPath(), checkInterval);
        future = taskScheduler.scheduleWithFixedDelay(this::checkForChanges,
                Instant.now().plus(checkInterval), checkInterval);
    }

    public synchronized void stop() {
        if (future != null) {
            future.cancel(false);
            future = null;
            log.info("Stopped monitoring {}", policyStore.getPolicyPath());
        }
    }

    /**
     * Reload and reschedule if the policy file changed since the last check.
     *
     * @return true if the policies were reloaded
     */
    public boolean checkForChanges() {
        if (jobScheduler.isStopped()) {
            return false;
        }
        Optional<FileTime> modified = currentModificationTime();
        if (modified.isEmpty() || modified.get().equals(lastModified)) {
            return false;
        }
        log.info("Policy file {} changed, reloading policies", policyStore.getPolicyPath());
        lastModified = modified.get();
        try {
            policyStore.reload();
            int scheduled = jobScheduler.rescheduleAllJobs();
            log.info("Rescheduled {} jobs after policy change", scheduled);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to reload policies from {}: {}", policyStore.getPolicyPath(), e.getMessage(), e);
            return false;
        }
    }

    private Optional<FileTime> currentModificationTime() {
        Optional<Path> file = policyStore.getPolicyFile();
        if (file.isEmpty() || !Files.exists(file.get())) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.getLastModifiedTime(file.get()));
        } catch (IOException e) {
            log.warn("Cannot read modification time of {}: {}", file.get(), e.getMessage());
            return Optional.empty();
        }
    }
}
