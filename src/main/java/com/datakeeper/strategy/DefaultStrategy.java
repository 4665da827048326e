package com.datakeeper.strategy;

import com.datakeeper.operation.Operation;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.policy.PolicyContext;

/**
 * Strategy that runs the operation as is, with no pre or post processing.
 * Registered as "default"; it is also the fallback for unknown strategy names.
 */
public class DefaultStrategy implements Strategy {

    public static final String NAME = "default";

    public static void register(PluginRegistry registry) {
        registry.registerStrategy(DefaultStrategy.class, DefaultStrategy::new);
    }

    @Override
    public OperationResult apply(Operation operation, PolicyContext context) {
        return operation.execute(context);
    }
}
