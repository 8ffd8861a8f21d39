package com.ai.coach.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SafetyFlags {

    boolean crisis;
    boolean thinkingMode;
    boolean pastTense;
    boolean uncertain;

    public static SafetyFlags none() {
        return SafetyFlags.builder().build();
    }
}
