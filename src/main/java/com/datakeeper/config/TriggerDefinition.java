package com.datakeeper.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A trigger attached to a policy.
 *
 * @param type Trigger type ("schedule", "on-demand", ...)
 * @param spec Opaque trigger payload; schedule triggers carry a sub-type under "type"
 */
public record TriggerDefinition(
        String type,
        Map<String, Object> spec
) {
    public static final String SCHEDULE = "schedule";

    public TriggerDefinition {
        spec = spec == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(spec));
    }

    public boolean isSchedule() {
        return SCHEDULE.equals(type);
    }

    /**
     * Sub-type of a schedule trigger (cron, interval, date), or null.
     */
    public String scheduleType() {
        Object value = spec.get("type");
        return value != null ? value.toString() : null;
    }

    /**
     * Trigger as a {type, spec} map, the shape persisted with a policy.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("spec", spec);
        return map;
    }
}
