package com.advisor.chase.exception;

/**
 * The persistence collaborator cannot be reached. Scheduling halts until an operator resumes it.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
