package com.ai.coach.exception;

/**
 * Session storage failed. Fatal for the request.
 */
public class PersistenceUnavailableException extends CoachException {

    public PersistenceUnavailableException(String message) {
        super("persistence", message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super("persistence", message, cause);
    }
}
