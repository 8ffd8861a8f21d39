package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Ordered substates of a coaching session. Each substate lists the criteria
 * that must all be met before the session may move on to the next one.
 */
public enum Substate {
    GOAL_AND_VISION("1.1_goal_and_vision", Stage.SAFETY_BUILDING,
            EnumSet.of(Criterion.GOAL_STATED, Criterion.VISION_ACCEPTED)),
    PSYCHO_EDUCATION("1.1.5_psycho_education", Stage.SAFETY_BUILDING,
            EnumSet.of(Criterion.PSYCHO_EDUCATION_PROVIDED)),
    PROBLEM_AND_BODY("1.2_problem_and_body", Stage.SAFETY_BUILDING,
            EnumSet.of(Criterion.PROBLEM_IDENTIFIED, Criterion.BODY_AWARENESS_PRESENT,
                    Criterion.PRESENT_MOMENT_FOCUS)),
    READINESS_ASSESSMENT("3.1_assess_readiness", Stage.DOWN_REGULATION,
            EnumSet.of(Criterion.READINESS_CONFIRMED, Criterion.RAPPORT_ESTABLISHED)),
    ALPHA_PERMISSION("3.1.5_alpha_permission", Stage.DOWN_REGULATION,
            EnumSet.of(Criterion.ALPHA_PERMISSION_GRANTED)),
    ALPHA_SEQUENCE("3.2_alpha_sequence", Stage.DOWN_REGULATION,
            EnumSet.of(Criterion.READY_FOR_NEXT_STAGE)),
    COMPLETE("complete", Stage.CLOSED, EnumSet.noneOf(Criterion.class));

    private final String code;
    private final Stage stage;
    private final Set<Criterion> requiredToAdvance;

    Substate(String code, Stage stage, Set<Criterion> requiredToAdvance) {
        this.code = code;
        this.stage = stage;
        this.requiredToAdvance = Collections.unmodifiableSet(requiredToAdvance);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Stage getStage() {
        return stage;
    }

    public Set<Criterion> getRequiredToAdvance() {
        return requiredToAdvance;
    }

    /** Successor in canonical order, or null for {@link #COMPLETE}. */
    public Substate next() {
        Substate[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : null;
    }

    public boolean isAtLeast(Substate other) {
        return ordinal() >= other.ordinal();
    }

    /** Substates where the user is talking freely rather than answering a guided protocol. */
    public boolean isConversational() {
        return ordinal() <= READINESS_ASSESSMENT.ordinal();
    }
}
