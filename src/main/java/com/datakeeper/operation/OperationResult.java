package com.datakeeper.operation;

import com.datakeeper.store.JobStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one operation run.
 *
 * @param operation     Operation name
 * @param status        Terminal status ({@link JobStatus#SUCCESS} or {@link JobStatus#FAILED})
 * @param affectedPaths Files deleted, would-be deleted, or rewritten
 * @param message       Summary, or the error text on failure
 */
public record OperationResult(
        String operation,
        JobStatus status,
        List<Path> affectedPaths,
        String message
) {
    public OperationResult {
        affectedPaths = affectedPaths == null ? List.of() : List.copyOf(affectedPaths);
    }

    public static OperationResult success(String operation, List<Path> affectedPaths, String message) {
        return new OperationResult(operation, JobStatus.SUCCESS, affectedPaths, message);
    }

    public static OperationResult failed(String operation, List<Path> affectedPaths, String error) {
        return new OperationResult(operation, JobStatus.FAILED, affectedPaths, error);
    }

    public boolean isSuccess() {
        return status == JobStatus.SUCCESS;
    }
}
