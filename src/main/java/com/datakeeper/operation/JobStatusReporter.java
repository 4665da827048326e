package com.datakeeper.operation;

import com.datakeeper.policy.PolicyContext;
import com.datakeeper.store.JobStatus;
import com.datakeeper.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Writes the job status transitions of one operation run into the state store.
 * Without a store or policy id in the context every transition is a no-op that succeeds.
 */
public final class JobStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(JobStatusReporter.class);

    private final StateStore stateStore;
    private final String policyId;

    private JobStatusReporter(StateStore stateStore, String policyId) {
        this.stateStore = stateStore;
        this.policyId = policyId;
    }

    public static JobStatusReporter forContext(PolicyContext context) {
        StateStore store = context.getStateStore().orElse(null);
        String policyId = context.getPolicyId().orElse(null);
        if (store == null || policyId == null) {
            log.debug("No state store or policy id in context {}, job status is not recorded",
                    context.getExecutionId());
            return new JobStatusReporter(null, null);
        }
        return new JobStatusReporter(store, policyId);
    }

    /**
     * @return false if the status could not be written
     */
    public boolean running() {
        return update(JobStatus.RUNNING, null);
    }

    public boolean success() {
        return update(JobStatus.SUCCESS, null);
    }

    public boolean failed(String error) {
        return update(JobStatus.FAILED, error);
    }

    private boolean update(JobStatus status, String error) {
        if (stateStore == null) {
            return true;
        }
        Map<String, Object> fields = new HashMap<>();
        fields.put("status", status);
        fields.put("last_error", error);
        boolean updated = stateStore.updateJob(policyId, fields);
        if (!updated) {
            log.error("Could not record status '{}' for policy {}", status.label(), policyId);
        }
        return updated;
    }
}
