package com.ai.coach.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the generative decision call is allowed to see.
 */
@Value
@Builder
public class PromptContext {

    String sessionId;
    String stage;
    String substate;
    String userText;
    String emotionalState;
    Map<String, Boolean> completion;
    Map<String, Integer> counters;
    List<String> recentExchanges;
    List<String> allowedDecisions;
}
