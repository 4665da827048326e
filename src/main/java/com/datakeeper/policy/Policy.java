package com.datakeeper.policy;

import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.config.TriggerDefinition;
import com.datakeeper.operation.OperationResult;

import java.util.List;
import java.util.Optional;

/**
 * A named lifecycle rule: decides whether a context matches and runs its operations.
 */
public interface Policy {

    /**
     * Unique id, also the key of the policy row and of the scheduled job.
     */
    String getId();

    String getName();

    /**
     * Kind name, as registered in the plugin registry ("retention", "downsampler").
     */
    String getKind();

    boolean isEnabled();

    List<TriggerDefinition> getTriggers();

    SelectorDefinition getSelector();

    String getStrategyName();

    /**
     * Operation names, in execution order.
     */
    List<String> getOperations();

    /**
     * Decide whether the context matches this policy.
     *
     * @param context Context to evaluate
     * @return Evaluation result; rejection is a result, never an exception
     */
    EvaluationResult evaluate(PolicyContext context);

    /**
     * Run the policy's operations, in order, through its strategy.
     *
     * @param context Caller supplied values, overlaid on the policy defaults
     * @return Result of the last operation, or empty when no operation ran
     */
    Optional<OperationResult> apply(PolicyContext context);

    /**
     * Trigger the scheduler registers this policy with: the first schedule trigger,
     * or the first trigger of any type.
     */
    default Optional<TriggerDefinition> getPrimaryTrigger() {
        List<TriggerDefinition> triggers = getTriggers();
        return triggers.stream()
                .filter(TriggerDefinition::isSchedule)
                .findFirst()
                .or(() -> triggers.stream().findFirst());
    }
}
