package com.datakeeper.config;

/**
 * A policy action: the policy kind to instantiate and its spec.
 *
 * @param type Policy kind name, resolved through the plugin registry
 * @param spec Parsed action spec
 */
public record ActionDefinition(
        String type,
        ActionSpec spec
) {
}
