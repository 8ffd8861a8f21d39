package com.ai.coach.exception;

/**
 * Base for failures raised by coaching collaborators. The message is prefixed with
 * the component that failed.
 */
public class CoachException extends RuntimeException {

    private final String component;

    public CoachException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public CoachException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
