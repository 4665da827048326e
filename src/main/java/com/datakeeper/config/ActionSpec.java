package com.datakeeper.config;

import java.util.List;

/**
 * Parsed "spec" block of a policy action.
 *
 * @param strategy         Strategy plugin name
 * @param operations       Operation plugin names, in execution order
 * @param retentionTime    Default retention time
 * @param warningTime      Warning lead time before deletion
 * @param timeUnit         Unit of retention and warning times
 * @param exceptions       Ordered retention overrides
 * @param methods          Downsampling steps (downsampler actions only)
 * @param preserveOriginal Accepted for policy-file compatibility; downsampled files always keep
 *                         their non-target groups, datasets and attributes
 */
public record ActionSpec(
        String strategy,
        List<String> operations,
        long retentionTime,
        long warningTime,
        String timeUnit,
        List<ExceptionRule> exceptions,
        List<DownsamplingMethod> methods,
        boolean preserveOriginal
) {
    public static final String DEFAULT_STRATEGY = "default";
    public static final long DEFAULT_RETENTION_TIME = 30;
    public static final long DEFAULT_WARNING_TIME = 7;
    public static final String DEFAULT_TIME_UNIT = "day";

    public ActionSpec {
        strategy = strategy == null || strategy.isBlank() ? DEFAULT_STRATEGY : strategy;
        operations = operations == null ? List.of() : List.copyOf(operations);
        timeUnit = timeUnit == null ? DEFAULT_TIME_UNIT : timeUnit;
        exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }
}
