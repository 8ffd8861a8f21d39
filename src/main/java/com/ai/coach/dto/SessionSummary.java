package com.ai.coach.dto;

import com.ai.coach.conversation.Substate;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** One row of the session list. */
@Value
@Builder
public class SessionSummary {

    String sessionId;
    Substate substate;
    int turnCount;
    Instant updatedAt;
}
