package com.datakeeper.operation;

import com.datakeeper.policy.PolicyContext;

/**
 * A unit of data-mutating work, invoked through a {@link com.datakeeper.strategy.Strategy}.
 * <p>
 * A fresh instance is created for every policy application.
 */
public interface Operation {

    /**
     * Execute the operation.
     *
     * @param context Effective context of the policy application
     * @return Outcome of the run; failures are reported, not thrown
     */
    OperationResult execute(PolicyContext context);
}
