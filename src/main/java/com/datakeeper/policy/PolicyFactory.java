package com.datakeeper.policy;

import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.plugin.PluginRegistry;

/**
 * Creates policies of one kind from their declarative definition.
 */
@FunctionalInterface
public interface PolicyFactory {

    /**
     * @param policyId   Unique id assigned to the instance
     * @param definition Parsed policy entry
     * @param registry   Registry the policy resolves strategies and operations from
     * @throws com.datakeeper.exception.ConfigurationException if the definition is invalid for this kind
     */
    Policy create(String policyId, PolicyDefinition definition, PluginRegistry registry);
}
