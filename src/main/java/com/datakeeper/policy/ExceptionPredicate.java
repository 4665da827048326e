package com.datakeeper.policy;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conditions a retention exception can test against context metadata.
 * Only these fixed equality checks are supported; there is no general expression language.
 */
enum ExceptionPredicate {

    PRIORITY_HIGH("priority", "high"),
    TAGGED_PRESERVE("tagged", "preserve");

    private static final Pattern METADATA_EQUALS =
            Pattern.compile("metadata\\.(\\w+)\\s*==\\s*(['\"])(.*?)\\2");

    private final String field;
    private final String value;

    ExceptionPredicate(String field, String value) {
        this.field = field;
        this.value = value;
    }

    /**
     * Parse a condition such as {@code metadata.priority == 'high'}. The first supported
     * equality found anywhere in the condition wins, so
     * {@code metadata.priority == 'high' and enabled} also maps to {@link #PRIORITY_HIGH}.
     *
     * @return The matching predicate, or empty if the condition contains no supported check
     */
    static Optional<ExceptionPredicate> parse(String condition) {
        if (condition == null) {
            return Optional.empty();
        }
        Matcher matcher = METADATA_EQUALS.matcher(condition);
        while (matcher.find()) {
            for (ExceptionPredicate predicate : values()) {
                if (predicate.field.equals(matcher.group(1)) && predicate.value.equals(matcher.group(3))) {
                    return Optional.of(predicate);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code condition} is nothing but this predicate's equality check.
     */
    boolean isWholeCondition(String condition) {
        Matcher matcher = METADATA_EQUALS.matcher(condition.strip());
        return matcher.matches() && field.equals(matcher.group(1)) && value.equals(matcher.group(3));
    }

    boolean test(Map<String, Object> metadata) {
        Object actual = metadata.get(field);
        return actual != null && value.equals(String.valueOf(actual));
    }

    @Override
    public String toString() {
        return "metadata." + field + " == '" + value + "'";
    }
}
