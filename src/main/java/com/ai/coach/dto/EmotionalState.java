package com.ai.coach.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EmotionalState {
    CRISIS_LEVEL("crisis_level"),
    MODERATE_DISTRESS("moderate_distress"),
    MILD_DISTRESS("mild_distress"),
    POSITIVE_STATE("positive_state"),
    NEUTRAL_UNCLEAR("neutral_unclear");

    private final String code;

    EmotionalState(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
