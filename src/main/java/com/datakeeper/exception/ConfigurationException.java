package com.datakeeper.exception;

/**
 * Exception thrown when a policy definition or application setting is invalid.
 * A single bad policy entry is skipped by the loader; an unreadable policy file fails the load.
 */
public class ConfigurationException extends DataKeeperException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
