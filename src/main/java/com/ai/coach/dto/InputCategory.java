package com.ai.coach.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InputCategory {
    GOAL_STATEMENT("goal_statement"),
    PROBLEM_DESCRIPTION("problem_description"),
    FEELING_STATEMENT("feeling_statement"),
    QUESTION("question"),
    AFFIRMATION("affirmation"),
    GREETING("greeting"),
    GENERAL_STATEMENT("general_statement");

    private final String code;

    InputCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
