package com.datakeeper.config;

import java.util.List;
import java.util.Map;

/**
 * Root of a policy file.
 *
 * @param source    Where the file was loaded from
 * @param settings  Global "settings" section, kept as raw values
 * @param templates "policy_templates" section, kept as raw values
 * @param policies  Valid policy entries, disabled ones included
 * @param skipped   Names (or positions) of entries rejected while parsing
 */
public record PolicyFileConfig(
        String source,
        Map<String, Object> settings,
        List<Map<String, Object>> templates,
        List<PolicyDefinition> policies,
        List<String> skipped
) {
    public List<PolicyDefinition> enabledPolicies() {
        return policies.stream().filter(PolicyDefinition::enabled).toList();
    }
}
