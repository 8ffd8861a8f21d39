package com.ai.coach.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial decision fields returned by the generative service. Any field may be null.
 */
@Value
@Builder
public class GenerativeDecision {

    String decision;
    String situationType;
    String retrievalTag;
    Boolean readyForNext;
    List<String> blockedBy;
    String reasoning;
}
