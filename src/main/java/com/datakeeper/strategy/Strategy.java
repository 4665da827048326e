package com.datakeeper.strategy;

import com.datakeeper.operation.Operation;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.policy.PolicyContext;

/**
 * Wraps the execution of an operation.
 * <p>
 * Strategies are the place for behavior around an operation (retry, batching, ...) that
 * should not live in the operation or the policy.
 */
public interface Strategy {

    /**
     * Apply the operation under this strategy.
     *
     * @param operation Operation to run
     * @param context   Effective context of the policy application
     * @return Result of the operation
     */
    OperationResult apply(Operation operation, PolicyContext context);
}
