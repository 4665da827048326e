package com.datakeeper.config;

/**
 * Ordered retention override. The first rule whose condition holds wins.
 *
 * @param condition     Condition text, e.g. {@code metadata.priority == 'high'}
 * @param retentionTime Overriding retention time, null to keep the policy default
 */
public record ExceptionRule(
        String condition,
        Long retentionTime
) {
}
