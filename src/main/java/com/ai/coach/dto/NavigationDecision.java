package com.ai.coach.dto;

import com.ai.coach.conversation.Substate;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Structured outcome of one turn: what to attempt next and why.
 * No conversational text, only the action and its payload.
 */
@Value
@Builder(toBuilder = true)
public class NavigationDecision {

    NavigationAction action;
    String situationType;
    String retrievalTag;
    boolean readyForNext;
    @Singular("blocker")
    List<String> blockedBy;
    String reasoning;
    boolean ruleOverrideApplied;
    boolean fallbackUsed;
    /** Name of the ladder rule that produced this decision, or "generative" / "default". */
    String appliedRule;
    Substate substate;
    @Singular("payloadEntry")
    Map<String, Object> payload;

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public boolean getFlag(String key) {
        return Boolean.TRUE.equals(payload.get(key));
    }
}
