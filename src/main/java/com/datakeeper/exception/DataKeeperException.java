package com.datakeeper.exception;

/**
 * Base exception for DataKeeper.
 */
public class DataKeeperException extends RuntimeException {

    public DataKeeperException(String message) {
        super(message);
    }

    public DataKeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}
