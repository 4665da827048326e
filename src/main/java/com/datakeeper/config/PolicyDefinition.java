package com.datakeeper.config;

import java.util.List;
import java.util.Optional;

/**
 * Declarative policy entry as read from the policy file.
 *
 * @param name        Policy name
 * @param description Free text description
 * @param enabled     Whether the policy is instantiated at all
 * @param triggers    Triggers, in declared order
 * @param selector    Matching criteria
 * @param actions     Actions; the first one determines the policy kind
 */
public record PolicyDefinition(
        String name,
        String description,
        boolean enabled,
        List<TriggerDefinition> triggers,
        SelectorDefinition selector,
        List<ActionDefinition> actions
) {
    public PolicyDefinition {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public ActionDefinition primaryAction() {
        return actions.get(0);
    }

    /**
     * First trigger of type "schedule", if any.
     */
    public Optional<TriggerDefinition> scheduleTrigger() {
        return triggers.stream().filter(TriggerDefinition::isSchedule).findFirst();
    }
}
