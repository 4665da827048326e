package com.datakeeper.scheduler;

import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.policy.Policy;
import com.datakeeper.policy.PolicyContext;
import com.datakeeper.policy.PolicyStore;
import com.datakeeper.store.JobStatus;
import com.datakeeper.store.StateStore;
import com.datakeeper.testutil.Definitions;
import com.datakeeper.testutil.FakeTaskScheduler;
import com.datakeeper.testutil.MutableClock;
import com.datakeeper.testutil.RecordingOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobScheduler, driving fires by hand through a recording task scheduler.
 */
class JobSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-04-12T01:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FakeTaskScheduler taskScheduler;
    private RecordingOperation recorder;
    private StateStore stateStore;
    private PolicyStore policyStore;
    private JobScheduler jobScheduler;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        taskScheduler = new FakeTaskScheduler();
        recorder = new RecordingOperation();
        PluginRegistry registry = PluginRegistry.withBuiltins();
        registry.registerOperation(RecordingOperation.class, () -> recorder);
        stateStore = StateStore.sqlite(tempDir.resolve("state.db"));

        Path file = tempDir.resolve("policy.yaml");
        Files.writeString(file, """
                policies:
                  - name: every-five
                    selector: {data_type: [csv]}
                    triggers: [{type: schedule, spec: {type: interval, unit: minutes, value: 5}}]
                    actions: [{type: retention, spec: {operations: [recording]}}]
                  - name: nightly
                    selector: {data_type: [csv]}
                    triggers: [{type: schedule, spec: {type: cron, cron: "0 2 * * *"}}]
                    actions: [{type: retention, spec: {operations: [recording]}}]
                  - name: manual
                    selector: {data_type: [csv]}
                    triggers: [{type: on-demand}]
                    actions: [{type: retention, spec: {operations: [recording]}}]
                """);
        policyStore = new PolicyStore(file.toString(), stateStore, registry);
        policyStore.load();
        jobScheduler = new JobScheduler(policyStore, stateStore, taskScheduler, clock, Duration.ofSeconds(60));
    }

    private Policy policy(String name) {
        return policyStore.getPolicyByName(name).orElseThrow();
    }

    private FakeTaskScheduler.Task taskAt(Instant startTime) {
        return taskScheduler.getActiveTasks().stream()
                .filter(task -> startTime.equals(task.getStartTime()))
                .reduce((first, second) -> second)
                .orElseThrow(() -> new AssertionError("No task armed for " + startTime));
    }

    private static TriggerDefinition date(String date) {
        return new TriggerDefinition(TriggerDefinition.SCHEDULE, Map.of("type", "date", "date", date));
    }

    @Test
    @DisplayName("Should register one job per scheduled policy and arm them on start")
    void shouldSetupAndStart() {
        assertEquals(2, jobScheduler.setupJobs());
        assertTrue(taskScheduler.getTasks().isEmpty());

        assertTrue(jobScheduler.start());

        assertTrue(jobScheduler.isRunning());
        assertEquals(Set.of(policy("every-five").getId(), policy("nightly").getId()), jobScheduler.getScheduledJobIds());
        assertEquals(Optional.of(Instant.parse("2025-04-12T01:05:00Z")),
                jobScheduler.getNextFireTime(policy("every-five").getId()));
        assertEquals(Optional.of(Instant.parse("2025-04-12T02:00:00Z")),
                jobScheduler.getNextFireTime(policy("nightly").getId()));
        assertEquals(2, taskScheduler.getActiveTasks().size());
        assertEquals(JobStatus.SCHEDULED,
                stateStore.findJobsByPolicy(policy("nightly").getId()).get(0).status());
    }

    @Test
    @DisplayName("Should run the policy on a fire and arm the next one")
    void shouldFireAndRearm() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        Instant firstFire = Instant.parse("2025-04-12T01:05:00Z");

        clock.set(firstFire.plusSeconds(1));
        taskAt(firstFire).run();

        assertEquals(1, recorder.getContexts().size());
        PolicyContext context = recorder.lastContext();
        assertTrue(context.isScheduled());
        assertEquals(Optional.of(firstFire), context.getTriggerTime());
        assertEquals(policy("every-five").getId(), context.getPolicyId().orElseThrow());
        assertTrue(context.getExecutionId().startsWith("exec_"));

        Instant secondFire = Instant.parse("2025-04-12T01:10:00Z");
        assertEquals(Optional.of(secondFire), jobScheduler.getNextFireTime(policy("every-five").getId()));
        assertNotNull(taskAt(secondFire));
    }

    @Test
    @DisplayName("Should skip a fire later than the misfire grace but keep the job")
    void shouldSkipMisfire() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        Instant firstFire = Instant.parse("2025-04-12T01:05:00Z");

        clock.set(firstFire.plus(Duration.ofMinutes(2)));
        taskAt(firstFire).run();

        assertTrue(recorder.getContexts().isEmpty());
        assertEquals(Optional.of(Instant.parse("2025-04-12T01:10:00Z")),
                jobScheduler.getNextFireTime(policy("every-five").getId()));
    }

    @Test
    @DisplayName("Should keep a job scheduled after its policy fails")
    void shouldSurvivePolicyFailure() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        recorder.failWith(new IllegalStateException("disk on fire"));
        String jobId = policy("every-five").getId();

        clock.set(Instant.parse("2025-04-12T01:05:00Z"));
        jobScheduler.fireNow(jobId, clock.instant());

        assertEquals(1, recorder.getContexts().size());
        assertTrue(jobScheduler.getScheduledJobIds().contains(jobId));
        assertEquals(Optional.of(Instant.parse("2025-04-12T01:10:00Z")), jobScheduler.getNextFireTime(jobId));
    }

    @Test
    @DisplayName("Should replace the job of a policy that is scheduled again")
    void shouldReplaceJob() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        Policy nightly = policy("nightly");
        FakeTaskScheduler.Task previous = taskAt(Instant.parse("2025-04-12T02:00:00Z"));

        Optional<String> jobId = jobScheduler.schedulePolicy(nightly, Definitions.cron("30 3 * * *"));

        assertEquals(Optional.of(nightly.getId()), jobId);
        assertEquals(2, jobScheduler.getJobCount());
        assertTrue(previous.isCancelled());
        assertEquals(Optional.of(Instant.parse("2025-04-12T03:30:00Z")), jobScheduler.getNextFireTime(nightly.getId()));

        previous.run();
        assertTrue(recorder.getContexts().isEmpty());
    }

    @Test
    @DisplayName("Should remove a date job after its single fire")
    void shouldRemoveOneShotJob() {
        jobScheduler.start();
        Policy policy = policy("nightly");
        Instant runAt = Instant.parse("2025-04-12T01:30:00Z");

        assertTrue(jobScheduler.schedulePolicy(policy, date("2025-04-12T01:30:00Z")).isPresent());
        clock.set(runAt);
        taskAt(runAt).run();

        assertEquals(1, recorder.getContexts().size());
        assertEquals(0, jobScheduler.getJobCount());
        assertTrue(jobScheduler.getNextFireTime(policy.getId()).isEmpty());
    }

    @Test
    @DisplayName("Should forget the running state of jobs that are no longer registered")
    void shouldReleaseRunningStateOfRemovedJobs() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        Instant firstFire = Instant.parse("2025-04-12T01:05:00Z");
        clock.set(firstFire.plusSeconds(1));
        taskAt(firstFire).run();
        jobScheduler.fireNow(policy("nightly").getId(), clock.instant());
        assertEquals(2, jobScheduler.getRunningFlagCount());

        Instant runAt = Instant.parse("2025-04-12T01:30:00Z");
        assertTrue(jobScheduler.schedulePolicy(policy("manual"), date("2025-04-12T01:30:00Z")).isPresent());
        clock.set(runAt);
        taskAt(runAt).run();

        assertEquals(3, recorder.getContexts().size());
        assertEquals(2, jobScheduler.getRunningFlagCount());

        assertEquals(2, jobScheduler.removeAllJobs());
        assertEquals(0, jobScheduler.getRunningFlagCount());
    }

    @Test
    @DisplayName("Should fire a past date within the misfire grace and reject older ones")
    void shouldHandlePastDates() {
        Policy policy = policy("nightly");

        assertTrue(jobScheduler.schedulePolicy(policy, date("2025-04-12T00:59:30Z")).isPresent());
        assertEquals(Optional.of(Instant.parse("2025-04-12T00:59:30Z")), jobScheduler.getNextFireTime(policy.getId()));

        assertTrue(jobScheduler.schedulePolicy(policy("every-five"), date("2025-04-12T00:58:00Z")).isEmpty());
    }

    @Test
    @DisplayName("Should not schedule an invalid trigger")
    void shouldRejectInvalidTrigger() {
        Optional<String> jobId = jobScheduler.schedulePolicy(policy("nightly"), Definitions.cron("not a cron"));

        assertTrue(jobId.isEmpty());
        assertEquals(0, jobScheduler.getJobCount());
    }

    @Test
    @DisplayName("Should register jobs again from the policy store")
    void shouldRescheduleAll() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        List<FakeTaskScheduler.Task> before = taskScheduler.getActiveTasks();

        assertEquals(2, jobScheduler.rescheduleAllJobs());

        assertTrue(before.stream().allMatch(FakeTaskScheduler.Task::isCancelled));
        assertEquals(2, taskScheduler.getActiveTasks().size());
    }

    @Test
    @DisplayName("Should cancel every job on shutdown and refuse new ones")
    void shouldShutdown() {
        jobScheduler.setupJobs();
        jobScheduler.start();
        List<FakeTaskScheduler.Task> armed = taskScheduler.getActiveTasks();

        jobScheduler.shutdown();

        assertTrue(jobScheduler.isStopped());
        assertFalse(jobScheduler.isRunning());
        assertEquals(0, jobScheduler.getJobCount());
        assertTrue(armed.stream().allMatch(FakeTaskScheduler.Task::isCancelled));
        assertTrue(jobScheduler.schedulePolicy(policy("nightly"), Definitions.cron("0 2 * * *")).isEmpty());
        assertFalse(jobScheduler.start());

        armed.forEach(FakeTaskScheduler.Task::run);
        assertTrue(recorder.getContexts().isEmpty());
    }
}
