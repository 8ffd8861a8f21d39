package com.ai.coach.dto;

import com.ai.coach.conversation.AnswerKind;

/**
 * Which kind of body information a question asks for.
 */
public enum BodyQuestionCategory {
    LOCATION,
    SENSATION,
    AWARENESS;

    /** True when the given answer already supplies exactly this kind of information. */
    public boolean isSuppliedBy(AnswerKind kind) {
        switch (this) {
            case LOCATION:
                return kind == AnswerKind.BODY_LOCATION;
            case SENSATION:
                return kind == AnswerKind.SENSATION_QUALITY;
            default:
                return false;
        }
    }
}
