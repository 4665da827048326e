package com.datakeeper.policy;

import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.store.JobRow;
import com.datakeeper.store.JobStatus;
import com.datakeeper.store.PolicyRow;
import com.datakeeper.store.StateStore;
import com.datakeeper.testutil.RecordingOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PolicyStore loading and persistence.
 */
class PolicyStoreTest {

    @TempDir
    Path tempDir;

    private StateStore stateStore;
    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        stateStore = StateStore.sqlite(tempDir.resolve("state.db"));
        registry = PluginRegistry.withBuiltins();
    }

    @Test
    @DisplayName("Should instantiate enabled policies with unique ids and persist their rows")
    void shouldLoadAndPersist() {
        PolicyStore store = new PolicyStore("classpath:policies/policies.yaml", stateStore, registry);

        List<Policy> policies = store.load();

        assertEquals(List.of("automatic-deletion", "sampling-reduction"),
                policies.stream().map(Policy::getName).toList());
        Policy deletion = policies.get(0);
        assertTrue(deletion.getId().startsWith("automatic-deletion-"));
        assertInstanceOf(RetentionPolicy.class, deletion);
        assertInstanceOf(DownsamplerPolicy.class, policies.get(1));

        PolicyRow row = stateStore.findPolicy(deletion.getId()).orElseThrow();
        assertEquals("automatic-deletion", row.name());
        assertEquals("classpath:policies/policies.yaml", row.policyFile());
        assertEquals(List.of("data-reduction"), row.operations());
        assertEquals(2, row.triggers().size());

        List<JobRow> jobs = stateStore.findJobsByPolicy(deletion.getId());
        assertEquals(1, jobs.size());
        JobRow job = jobs.get(0);
        assertEquals(JobStatus.ADDED, job.status());
        assertEquals("data-reduction", job.name());
        assertEquals("schedule", job.triggerType());
        assertEquals("cron", job.triggerSpec().get("type"));
        assertTrue(job.operation().endsWith("DataReductionOperation"));
        assertEquals("[\"/tmp/datakeeper-data\"]", job.filetypes());
    }

    @Test
    @DisplayName("Should generate a new id on every load")
    void shouldGenerateUniqueIds() {
        PolicyStore first = new PolicyStore("classpath:policies/policies.yaml", stateStore, registry);
        PolicyStore second = new PolicyStore("classpath:policies/policies.yaml", stateStore, registry);

        String a = first.load().get(0).getId();
        String b = second.load().get(0).getId();

        assertNotEquals(a, b);
        assertEquals(4, stateStore.findAllPolicies().size());
    }

    @Test
    @DisplayName("Should skip unknown kinds and policies without triggers")
    void shouldSkipInvalidPolicies() {
        PolicyStore store = new PolicyStore("classpath:policies/mixed-kinds.yaml", stateStore, registry);

        List<Policy> policies = store.load();

        assertEquals(List.of("known", "on-demand-only"), policies.stream().map(Policy::getName).toList());
        assertEquals(2, stateStore.findAllPolicies().size());
        assertEquals(1, store.getScheduledPolicies().size());
        assertEquals("known", store.getScheduledPolicies().get(0).policy().getName());
        assertEquals(1, store.getPoliciesByTriggerType("on-demand").size());
    }

    @Test
    @DisplayName("Should yield no policies for a missing file")
    void shouldHandleMissingFile() {
        PolicyStore store = new PolicyStore(tempDir.resolve("missing.yaml").toString(), stateStore, registry);

        assertTrue(store.load().isEmpty());
        assertTrue(store.getPolicyFile().isEmpty());
    }

    @Test
    @DisplayName("Should expose settings, templates and policies by name")
    void shouldExposeFileSections() {
        PolicyStore store = new PolicyStore("classpath:policies/policies.yaml", stateStore, registry);
        store.load();

        assertEquals("info", store.getSettings().get("log_level"));
        assertEquals(1, store.getTemplates().size());
        assertTrue(store.getPolicyByName("sampling-reduction").isPresent());
        assertTrue(store.getPolicyByName("disabled-policy").isEmpty());
    }

    @Test
    @DisplayName("Should replace rows of the previous load on reload")
    void shouldReload() throws Exception {
        Path file = tempDir.resolve("policy.yaml");
        Files.writeString(file, policyYaml("first"));
        PolicyStore store = new PolicyStore(file.toString(), stateStore, registry);
        String firstId = store.load().get(0).getId();

        Files.writeString(file, policyYaml("second"));
        List<Policy> reloaded = store.reload();

        assertEquals("second", reloaded.get(0).getName());
        assertTrue(stateStore.findPolicy(firstId).isEmpty());
        assertEquals(1, stateStore.findAllPolicies().size());
        assertEquals(file, store.getPolicyFile().orElseThrow());
    }

    @Test
    @DisplayName("Should apply accepted policies and isolate failures")
    void shouldApplyPolicies() throws Exception {
        RecordingOperation recorder = new RecordingOperation();
        registry.registerOperation(RecordingOperation.class, () -> recorder);
        Path file = tempDir.resolve("policy.yaml");
        Files.writeString(file, """
                policies:
                  - name: csv-policy
                    selector: {data_type: [csv]}
                    triggers: [{type: schedule, spec: {type: cron, cron: "0 0 * * *"}}]
                    actions: [{type: retention, spec: {operations: [recording]}}]
                  - name: hdf5-policy
                    selector: {data_type: [hdf5]}
                    triggers: [{type: schedule, spec: {type: cron, cron: "0 0 * * *"}}]
                    actions: [{type: retention, spec: {operations: [recording]}}]
                """);
        PolicyStore store = new PolicyStore(file.toString(), stateStore, registry);
        store.load();

        Optional<OperationResult> result = store.applyPolicies(
                PolicyContext.builder().dataTypes(List.of("csv")).build());

        assertTrue(result.orElseThrow().isSuccess());
        assertEquals(1, recorder.getContexts().size());
        assertEquals("csv-policy", recorder.lastContext().getPolicyName().orElseThrow());

        recorder.failWith(new IllegalStateException("boom"));
        assertTrue(store.applyPolicies(PolicyContext.empty()).isEmpty());
        assertEquals(3, recorder.getContexts().size());
    }

    private static String policyYaml(String name) {
        return """
                policies:
                  - name: %s
                    selector:
                      data_type: [csv]
                      paths: [/tmp/data]
                    triggers:
                      - type: schedule
                        spec: {type: interval, unit: minutes, value: 5}
                    actions:
                      - type: retention
                        spec:
                          operations: [data-reduction]
                """.formatted(name);
    }
}
