package com.ai.coach.dto;

import com.ai.coach.conversation.EngagementLog;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.Stage;
import com.ai.coach.conversation.Substate;
import com.ai.coach.conversation.checkpoint.CheckpointSequence;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only progress summary of a session.
 */
@Value
@Builder
public class SessionSnapshot {

    String sessionId;
    Stage stage;
    Substate substate;
    int turnCount;
    Map<String, Boolean> criteria;
    Map<String, String> evidence;
    Map<String, Integer> counters;
    List<String> coveredTopics;
    List<String> completionEvents;
    /** Null until the relaxation sequence has started. */
    Map<String, Object> checkpoint;
    boolean downRegulated;
    Map<String, Object> engagement;

    public static SessionSnapshot of(SessionState state) {
        Map<String, Integer> counters = new LinkedHashMap<>();
        counters.put("bodyQuestionsAsked", state.getBodyQuestionsAsked());
        counters.put("bodyEnquiryCycles", state.getBodyEnquiryCycles());
        counters.put("anythingElseAskedCount", state.getAnythingElseAskedCount());
        counters.put("reentryCount", state.getReentryCount());

        EngagementLog engagement = state.getEngagement();
        Map<String, Object> engagementSummary = new LinkedHashMap<>();
        engagementSummary.put("consecutiveMinimal", engagement.getConsecutiveMinimal());
        engagementSummary.put("consecutiveNonResponses", engagement.getConsecutiveNonResponses());
        engagementSummary.put("confusionCount", engagement.getConfusionCount());
        engagementSummary.put("lowLevelTurns", engagement.lowLevelCount());

        CheckpointSequence sequence = state.getCheckpoint();
        return SessionSnapshot.builder()
                .sessionId(state.getSessionId())
                .stage(state.getStage())
                .substate(state.getSubstate())
                .turnCount(state.getTurnCount())
                .criteria(state.getCompletion().asMap())
                .evidence(state.getCompletion().evidenceMap())
                .counters(counters)
                .coveredTopics(List.copyOf(state.getCoveredTopics()))
                .completionEvents(state.getCompletionEvents().stream()
                        .map(e -> e.getTurn() + ":" + e.getEvent())
                        .collect(Collectors.toList()))
                .checkpoint(sequence != null ? sequence.summary() : null)
                .downRegulated(sequence != null && sequence.isDownRegulated())
                .engagement(engagementSummary)
                .build();
    }
}
