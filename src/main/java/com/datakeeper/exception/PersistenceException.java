package com.datakeeper.exception;

/**
 * Exception thrown when the state store cannot read or write its rows.
 */
public class PersistenceException extends DataKeeperException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
