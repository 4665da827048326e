package com.datakeeper.policy;

import com.datakeeper.config.ExceptionRule;

import java.util.Optional;

/**
 * Result of policy evaluation.
 */
public interface EvaluationResult {

    /**
     * Whether the context satisfies the policy's selector.
     */
    boolean isAccepted();

    /**
     * Retention time the policy applies for this context: the override of the matched
     * exception rule, or the policy default. Empty for policies without retention.
     */
    Optional<Long> getEffectiveRetentionTime();

    /**
     * Exception rule that overrode the retention time, if any.
     */
    Optional<ExceptionRule> getMatchedException();

    /**
     * Get human-readable explanation of the decision.
     */
    String getExplanation();
}
