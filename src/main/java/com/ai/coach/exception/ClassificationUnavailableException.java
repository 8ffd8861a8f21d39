package com.ai.coach.exception;

/**
 * Text classification failed; the turn continues with neutral input.
 */
public class ClassificationUnavailableException extends CoachException {

    public ClassificationUnavailableException(String message) {
        super("classifier", message);
    }

    public ClassificationUnavailableException(String message, Throwable cause) {
        super("classifier", message, cause);
    }
}
