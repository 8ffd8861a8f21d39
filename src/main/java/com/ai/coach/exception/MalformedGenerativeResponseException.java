package com.ai.coach.exception;

/**
 * The generative service answered without a usable decision.
 */
public class MalformedGenerativeResponseException extends CoachException {

    public MalformedGenerativeResponseException(String message) {
        super("generative", message);
    }

    public MalformedGenerativeResponseException(String message, Throwable cause) {
        super("generative", message, cause);
    }
}
