package com.datakeeper.store;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Persisted job: one operation of one policy.
 *
 * @param id          Job id
 * @param policyId    Owning policy id
 * @param name        Operation name as configured
 * @param operation   Resolved operation descriptor
 * @param filetypes   Applicable file types / paths (JSON text)
 * @param triggerType Trigger type
 * @param triggerSpec Trigger payload
 * @param status      Current status
 * @param lastError   Last error text, null when the last run succeeded
 * @param createdAt   Creation time (UTC)
 * @param lastRunTime Time of the last status update (UTC), null before the first one
 */
public record JobRow(
        String id,
        String policyId,
        String name,
        String operation,
        String filetypes,
        String triggerType,
        Map<String, Object> triggerSpec,
        JobStatus status,
        String lastError,
        LocalDateTime createdAt,
        LocalDateTime lastRunTime
) {
    /**
     * Create a freshly added job row.
     */
    public static JobRow added(String id, String policyId, String name, String operation,
                               String filetypes, String triggerType, Map<String, Object> triggerSpec) {
        return new JobRow(id, policyId, name, operation, filetypes, triggerType, triggerSpec,
                JobStatus.ADDED, null, null, null);
    }
}
