package com.ai.coach.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * What the assistant attempts next. Codes are the wire names used in decisions
 * and in generative responses.
 */
public enum NavigationAction {
    CLARIFY_GOAL("clarify_goal", "goal_needs_clarification", "goal_clarification"),
    BUILD_VISION("build_vision", "goal_stated_needs_vision", "future_self_vision"),
    PROVIDE_PSYCHO_EDUCATION("provide_psycho_education", "education_pending", "psycho_education"),
    EXPLORE_PROBLEM("explore_problem", "problem_needs_exploration", "problem_exploration"),
    BODY_AWARENESS_INQUIRY("body_awareness_inquiry", "body_symptoms_exploration", "body_location",
            BodyQuestionCategory.LOCATION),
    BODY_SENSATION_INQUIRY("body_sensation_inquiry", "body_symptoms_exploration", "body_sensation",
            BodyQuestionCategory.SENSATION),
    PRESENT_MOMENT_INQUIRY("present_moment_inquiry", "present_moment_check", "present_moment",
            BodyQuestionCategory.AWARENESS),
    ASK_WHAT_ELSE("ask_what_else", "body_enquiry_cycle", "what_else"),
    PATTERN_INQUIRY("pattern_inquiry", "explore_trigger_pattern", "trigger_pattern"),
    ASSESS_READINESS("assess_readiness", "readiness_for_stage_2", "readiness"),
    REQUEST_ALPHA_PERMISSION("request_alpha_permission", "alpha_permission_pending", "alpha_permission"),
    REASSURE_ALPHA_PERMISSION("reassure_alpha_permission", "alpha_permission_hesitant", "alpha_permission"),
    CHECKPOINT_INSTRUCTION("checkpoint_instruction", "alpha_sequence_step", "checkpoint"),
    NORMALIZE_RESISTANCE("normalize_resistance", "alpha_sequence_resistance", "checkpoint_resistance"),
    RETRY_CHECKPOINT("retry_checkpoint", "alpha_sequence_neutral", "checkpoint"),
    CLARIFY_CHECKPOINT("clarify_checkpoint", "alpha_sequence_unclear", "checkpoint"),
    SEQUENCE_COMPLETE("sequence_complete", "alpha_sequence_complete", "closing"),
    SESSION_CLOSED("session_closed", "session_complete", "closing"),
    GENERAL_INQUIRY("general_inquiry", "general_therapeutic_inquiry", "general_inquiry"),
    SAFETY_ESCALATION("safety_escalation", "crisis_detected", "safety"),
    REDIRECT_PAST("redirect_past", "past_focus", "redirect_past"),
    REDIRECT_THINKING("redirect_thinking", "thinking_mode", "redirect_thinking"),
    OFFER_OUTCOME_MENU("offer_outcome_menu", "client_uncertain", "outcome_menu"),
    CLARIFY_CONFUSION("clarify_confusion", "client_confused", "clarify"),
    ENGAGEMENT_CHECK("engagement_check", "client_disengaged", "engagement");

    private final String code;
    private final String situationType;
    private final String retrievalTag;
    private final BodyQuestionCategory bodyCategory;

    NavigationAction(String code, String situationType, String retrievalTag) {
        this(code, situationType, retrievalTag, null);
    }

    NavigationAction(String code, String situationType, String retrievalTag, BodyQuestionCategory bodyCategory) {
        this.code = code;
        this.situationType = situationType;
        this.retrievalTag = retrievalTag;
        this.bodyCategory = bodyCategory;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getSituationType() {
        return situationType;
    }

    public String getRetrievalTag() {
        return retrievalTag;
    }

    /** Body category asked about, or null when this is not a body question. */
    public BodyQuestionCategory getBodyCategory() {
        return bodyCategory;
    }

    public boolean isBodyQuestion() {
        return bodyCategory != null;
    }

    public static Optional<NavigationAction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String wanted = code.trim().toLowerCase();
        for (NavigationAction action : values()) {
            if (action.code.equals(wanted)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
