package com.datakeeper.exception;

/**
 * Exception raised by an operation while it mutates data.
 * Its message is what ends up in the job's last_error column.
 */
public class OperationException extends DataKeeperException {

    public OperationException(String message) {
        super(message);
    }

    public OperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
