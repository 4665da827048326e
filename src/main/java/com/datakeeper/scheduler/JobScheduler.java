package com.datakeeper.scheduler;

import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.exception.ConfigurationException;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.policy.Policy;
import com.datakeeper.policy.PolicyContext;
import com.datakeeper.policy.PolicyStore;
import com.datakeeper.policy.PolicyTrigger;
import com.datakeeper.store.JobStatus;
import com.datakeeper.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs policies on their schedule triggers.
 * <p>
 * Each policy is one job, keyed by the policy id; registering a policy again replaces its job.
 * A job is armed for one fire at a time and re-armed after the fire completes, so runs of one
 * job never overlap and fires missed while it ran collapse into the next one. A fire that
 * starts later than the misfire grace after its scheduled time is skipped.
 * <p>
 * Stopping prevents further fires; a run in progress is not interrupted.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    public static final Duration DEFAULT_MISFIRE_GRACE = Duration.ofSeconds(60);

    private final PolicyStore policyStore;
    private final StateStore stateStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration misfireGrace;

    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> runningByJobId = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public JobScheduler(PolicyStore policyStore, StateStore stateStore, TaskScheduler taskScheduler) {
        this(policyStore, stateStore, taskScheduler, Clock.systemDefaultZone(), DEFAULT_MISFIRE_GRACE);
    }

    public JobScheduler(PolicyStore policyStore, StateStore stateStore, TaskScheduler taskScheduler,
                        Clock clock, Duration misfireGrace) {
        this.policyStore = policyStore;
        this.stateStore = stateStore;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.misfireGrace = misfireGrace;
    }

    /**
     * Start firing jobs. Jobs registered before the start are armed now.
     *
     * @return false if the scheduler was already stopped
     */
    public boolean start() {
        if (stopped.get()) {
            log.error("Cannot start JobScheduler after it was stopped");
            return false;
        }
        if (started.compareAndSet(false, true)) {
            log.info("Starting JobScheduler with {} registered jobs", jobs.size());
            for (ScheduledJob job : jobs.values()) {
                synchronized (job) {
                    if (job.future == null) {
                        arm(job, job.nextFireTime);
                    }
                }
            }
        }
        return true;
    }

    /**
     * Register a job for every enabled policy with a schedule trigger.
     *
     * @return Number of jobs registered
     */
    public int setupJobs() {
        log.info("Setting up scheduled jobs");
        List<PolicyTrigger> scheduled = policyStore.getScheduledPolicies();
        int count = 0;
        for (PolicyTrigger entry : scheduled) {
            if (schedulePolicy(entry.policy(), entry.trigger()).isPresent()) {
                count++;
            }
        }
        log.info("Scheduled {} jobs from {} policies", count, scheduled.size());
        return count;
    }

    /**
     * Register (or replace) the job of a policy.
     *
     * @return The job id, or empty if the trigger spec is invalid or never fires
     */
    public Optional<String> schedulePolicy(Policy policy, TriggerDefinition trigger) {
        if (stopped.get()) {
            log.warn("JobScheduler is stopped, not scheduling policy '{}'", policy.getName());
            return Optional.empty();
        }

        Instant now = clock.instant();
        FireSchedule schedule;
        try {
            schedule = TriggerFactory.create(trigger, now, clock.getZone());
        } catch (ConfigurationException e) {
            log.error("Cannot schedule policy '{}': {}", policy.getName(), e.getMessage());
            return Optional.empty();
        }

        Optional<Instant> firstFire = schedule.firstFire(now, misfireGrace);
        if (firstFire.isEmpty()) {
            log.warn("Schedule {} of policy '{}' has no future fire time, not scheduled",
                    schedule.describe(), policy.getName());
            return Optional.empty();
        }

        String jobId = policy.getId();
        ScheduledJob job = new ScheduledJob(jobId, policy, schedule);
        ScheduledJob previous = jobs.put(jobId, job);
        if (previous != null) {
            previous.cancel();
            log.info("Replaced existing job {}", jobId);
        }
        arm(job, firstFire.get());

        log.info("Scheduled policy '{}' with {} (job ID: {}, first run: {})",
                policy.getName(), schedule.describe(), jobId, firstFire.get());
        stateStore.updateJob(jobId, Map.of("status", JobStatus.SCHEDULED));
        return Optional.of(jobId);
    }

    /**
     * Remove every registered job and register the jobs of the policy store again.
     *
     * @return Number of jobs registered
     */
    public int rescheduleAllJobs() {
        int removed = removeAllJobs();
        log.info("Removed {} jobs, rescheduling from policy store", removed);
        return setupJobs();
    }

    /**
     * Cancel and forget every job.
     *
     * @return Number of jobs removed
     */
    public int removeAllJobs() {
        List<ScheduledJob> removed = new ArrayList<>(jobs.values());
        for (ScheduledJob job : removed) {
            jobs.remove(job.id, job);
            job.cancel();
            releaseRunningFlag(job.id);
        }
        return removed.size();
    }

    /**
     * Stop scheduling. No job fires after this call; a running job completes on its own.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down JobScheduler...");
        int removed = removeAllJobs();
        log.info("JobScheduler shutdown complete, {} jobs cancelled", removed);
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public int getJobCount() {
        return jobs.size();
    }

    public Set<String> getScheduledJobIds() {
        return new TreeSet<>(jobs.keySet());
    }

    /**
     * Next fire time of a job, if it is armed.
     */
    public Optional<Instant> getNextFireTime(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(job -> job.nextFireTime);
    }

    /**
     * Set the next fire of a job; before {@link #start()} the fire stays pending.
     */
    private void arm(ScheduledJob job, Instant at) {
        synchronized (job) {
            if (stopped.get() || job.cancelled) {
                return;
            }
            job.nextFireTime = at;
            if (started.get()) {
                job.future = taskScheduler.schedule(() -> fire(job.id, job, at), at);
            }
        }
    }

    /**
     * Fire a registered job now, as if it had been scheduled for {@code scheduledFor}.
     */
    void fireNow(String jobId, Instant scheduledFor) {
        ScheduledJob job = jobs.get(jobId);
        if (job != null) {
            fire(jobId, job, scheduledFor);
        }
    }

    /**
     * Handle a fire of a job scheduled for {@code scheduledFor}.
     */
    void fire(String jobId, ScheduledJob job, Instant scheduledFor) {
        if (stopped.get() || jobs.get(jobId) != job) {
            return;
        }
        try {
            Duration lateness = Duration.between(scheduledFor, clock.instant());
            if (lateness.compareTo(misfireGrace) > 0) {
                log.warn("Run of job {} scheduled for {} was missed by {}, skipping", jobId, scheduledFor, lateness);
                return;
            }
            AtomicBoolean running = runningByJobId.computeIfAbsent(jobId, id -> new AtomicBoolean(false));
            if (!running.compareAndSet(false, true)) {
                log.warn("Job {} is still running, skipping run scheduled for {}", jobId, scheduledFor);
                return;
            }
            try {
                execute(job, scheduledFor);
            } finally {
                running.set(false);
            }
        } finally {
            rearm(job);
            releaseRunningFlag(jobId);
        }
    }

    /**
     * Drop the running flag of a job id that is no longer registered, unless a run still holds it.
     * A replaced job keeps the flag of its predecessor.
     */
    private void releaseRunningFlag(String jobId) {
        if (!jobs.containsKey(jobId)) {
            runningByJobId.computeIfPresent(jobId, (id, running) -> running.get() ? running : null);
        }
    }

    int getRunningFlagCount() {
        return runningByJobId.size();
    }

    private void rearm(ScheduledJob job) {
        if (stopped.get() || jobs.get(job.id) != job) {
            return;
        }
        Optional<Instant> next = job.schedule.nextFireAfter(clock.instant());
        if (next.isPresent()) {
            arm(job, next.get());
        } else {
            log.info("Job {} has no further runs, removing it", job.id);
            jobs.remove(job.id, job);
        }
    }

    private void execute(ScheduledJob job, Instant scheduledFor) {
        Policy policy = job.policy;
        log.info("Executing scheduled policy '{}'", policy.getName());
        PolicyContext context = PolicyContext.builder()
                .scheduled(true)
                .policyId(policy.getId())
                .policyName(policy.getName())
                .triggerTime(scheduledFor)
                .executionId("exec_" + UUID.randomUUID())
                .stateStore(stateStore)
                .build();
        try {
            Optional<OperationResult> result = policy.apply(context);
            log.info("Job {} executed successfully: {}", job.id,
                    result.map(r -> r.status().label() + " (" + r.message() + ")").orElse("no operation ran"));
        } catch (RuntimeException e) {
            log.error("Job {} encountered an error: {}", job.id, e.getMessage(), e);
        }
    }

    /**
     * A registered job: the policy, its schedule and the currently armed fire.
     */
    static final class ScheduledJob {
        private final String id;
        private final Policy policy;
        private final FireSchedule schedule;
        private volatile Instant nextFireTime;
        private ScheduledFuture<?> future;
        private boolean cancelled;

        ScheduledJob(String id, Policy policy, FireSchedule schedule) {
            this.id = id;
            this.policy = policy;
            this.schedule = schedule;
        }

        synchronized void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
