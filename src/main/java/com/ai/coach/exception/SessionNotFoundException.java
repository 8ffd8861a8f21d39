package com.ai.coach.exception;

public class SessionNotFoundException extends CoachException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("persistence", "No session with id " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
