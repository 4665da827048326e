package com.datakeeper.store;

import java.util.Locale;

/**
 * Job lifecycle: added -> scheduled -> running -> {success, failed}.
 */
public enum JobStatus {
    ADDED,
    SCHEDULED,
    RUNNING,
    SUCCESS,
    FAILED;

    /**
     * Value stored in the job.status column.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    /**
     * Parse a stored or legacy status label. "completed" is folded into {@link #SUCCESS}
     * and "registered" into {@link #ADDED}.
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static JobStatus fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Job status label is null");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "completed" -> SUCCESS;
            case "registered" -> ADDED;
            default -> JobStatus.valueOf(normalized.toUpperCase(Locale.ROOT));
        };
    }
}
