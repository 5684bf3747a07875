package com.payguard.agent.error;

/**
 * Raised when the state store cannot be read or written.
 * Fatal for the current cycle only; the next cycle resumes from the last durable state.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
