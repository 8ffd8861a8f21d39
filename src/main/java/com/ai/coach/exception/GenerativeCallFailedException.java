package com.ai.coach.exception;

/**
 * The generative decision call failed or is not configured.
 */
public class GenerativeCallFailedException extends CoachException {

    public GenerativeCallFailedException(String message) {
        super("generative", message);
    }

    public GenerativeCallFailedException(String message, Throwable cause) {
        super("generative", message, cause);
    }
}
