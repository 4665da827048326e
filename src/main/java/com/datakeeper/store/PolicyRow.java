package com.datakeeper.store;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Persisted bookkeeping row of a policy.
 *
 * @param id         Unique id (policy name + generated token)
 * @param name       Policy name
 * @param policyFile Source policy file
 * @param enabled    Enabled flag
 * @param strategy   Strategy name
 * @param dataTypes  Selector data types
 * @param tags       Selector tags
 * @param paths      Selector paths
 * @param operations Operation names, in order
 * @param triggers   Triggers as {type, spec} maps
 * @param createdAt  Creation time (UTC), null until read back
 * @param updatedAt  Update time (UTC), null until read back
 */
public record PolicyRow(
        String id,
        String name,
        String policyFile,
        boolean enabled,
        String strategy,
        List<String> dataTypes,
        List<String> tags,
        List<String> paths,
        List<String> operations,
        List<Map<String, Object>> triggers,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    /**
     * Create a row to insert; timestamps are assigned by the store.
     */
    public static PolicyRow of(String id, String name, String policyFile, boolean enabled, String strategy,
                               List<String> dataTypes, List<String> tags, List<String> paths,
                               List<String> operations, List<Map<String, Object>> triggers) {
        return new PolicyRow(id, name, policyFile, enabled, strategy, dataTypes, tags, paths,
                operations, triggers, null, null);
    }
}
