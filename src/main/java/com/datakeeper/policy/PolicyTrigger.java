package com.datakeeper.policy;

import com.datakeeper.config.TriggerDefinition;

/**
 * A policy paired with one of its triggers.
 */
public record PolicyTrigger(Policy policy, TriggerDefinition trigger) {
}
