package com.feedbackengine.common.exception;

/**
 * Persisted learning state (weights, portfolio memory) could not be read or written.
 * Corrupted state at startup is fatal unless a fresh start is explicitly requested.
 */
public class PersistenceException extends EngineException {

    public PersistenceException(String component, String message) {
        super(component, message);
    }

    public PersistenceException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
