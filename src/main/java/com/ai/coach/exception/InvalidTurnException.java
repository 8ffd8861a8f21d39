package com.ai.coach.exception;

public class InvalidTurnException extends CoachException {

    public InvalidTurnException(String message) {
        super("turn", message);
    }
}
