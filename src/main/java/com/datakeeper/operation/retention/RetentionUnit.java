package com.datakeeper.operation.retention;

import java.util.Locale;

/**
 * Time units a retention period can be expressed in.
 */
public enum RetentionUnit {

    SECOND(1),
    MINUTE(60),
    HOUR(60 * 60),
    DAY(60 * 60 * 24);

    private final long seconds;

    RetentionUnit(long seconds) {
        this.seconds = seconds;
    }

    public long getSeconds() {
        return seconds;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a unit name: case-insensitive, singular or plural ("day", "Days").
     *
     * @throws IllegalArgumentException if the name is not a known unit
     */
    public static RetentionUnit fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Time unit is empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.endsWith("S")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        for (RetentionUnit unit : values()) {
            if (unit.name().equals(normalized)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("Unknown time unit: " + name);
    }
}
