package com.datakeeper.testutil;

import com.datakeeper.config.ActionDefinition;
import com.datakeeper.config.ActionSpec;
import com.datakeeper.config.DownsamplingMethod;
import com.datakeeper.config.ExceptionRule;
import com.datakeeper.config.PolicyDefinition;
import com.datakeeper.config.SelectorDefinition;
import com.datakeeper.config.TriggerDefinition;

import java.util.List;
import java.util.Map;

/**
 * Policy definitions for tests.
 */
public final class Definitions {

    private Definitions() {
    }

    public static TriggerDefinition cron(String expression) {
        return new TriggerDefinition(TriggerDefinition.SCHEDULE, Map.of("type", "cron", "cron", expression));
    }

    public static TriggerDefinition interval(String unit, int value) {
        return new TriggerDefinition(TriggerDefinition.SCHEDULE, Map.of("type", "interval", "unit", unit, "value", value));
    }

    public static PolicyDefinition retention(String name, SelectorDefinition selector, List<String> operations,
                                             long retentionTime, String timeUnit, List<ExceptionRule> exceptions,
                                             String strategy, List<TriggerDefinition> triggers) {
        ActionSpec spec = new ActionSpec(strategy, operations, retentionTime, 7, timeUnit, exceptions, List.of(), true);
        return new PolicyDefinition(name, "", true, triggers, selector, List.of(new ActionDefinition("retention", spec)));
    }

    public static PolicyDefinition retention(String name, List<String> operations, long retentionTime,
                                             TriggerDefinition trigger) {
        return retention(name, new SelectorDefinition(List.of("csv"), List.of(), List.of("/data")), operations,
                retentionTime, "day", List.of(), "default", List.of(trigger));
    }

    public static PolicyDefinition downsampler(String name, SelectorDefinition selector, List<String> operations,
                                               List<DownsamplingMethod> methods, boolean preserveOriginal) {
        ActionSpec spec = new ActionSpec("default", operations, 30, 7, "day", List.of(), methods, preserveOriginal);
        return new PolicyDefinition(name, "", true, List.of(cron("0 0 * * *")), selector,
                List.of(new ActionDefinition("downsampler", spec)));
    }
}
