package com.agentbox.core.persistence;

/**
 * Raised when a write to the core API fails after all retry attempts.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
