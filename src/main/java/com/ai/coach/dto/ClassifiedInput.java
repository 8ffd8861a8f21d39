package com.ai.coach.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the text signal classifier for one user message.
 */
@Value
@Builder
public class ClassifiedInput {

    String correctedText;
    EmotionalState emotionalState;
    InputCategory inputCategory;
    SafetyFlags safetyFlags;

    /** Used when classification is unavailable: raw text, no signals. */
    public static ClassifiedInput neutral(String rawText) {
        return ClassifiedInput.builder()
                .correctedText(rawText == null ? "" : rawText.trim())
                .emotionalState(EmotionalState.NEUTRAL_UNCLEAR)
                .inputCategory(InputCategory.GENERAL_STATEMENT)
                .safetyFlags(SafetyFlags.none())
                .build();
    }
}
