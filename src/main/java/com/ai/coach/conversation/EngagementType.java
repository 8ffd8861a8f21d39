package com.ai.coach.conversation;

/**
 * Shape of a single client reply, judged for engagement rather than content.
 */
public enum EngagementType {
    /** Named a goal, a feeling, a body detail or said there is nothing more. */
    ANSWERED(EngagementLevel.HIGH),
    ENGAGED(EngagementLevel.HIGH),
    CONFIRMATION_WITH_CONTENT(EngagementLevel.HIGH),
    MODERATE(EngagementLevel.MEDIUM),
    MINIMAL_CONFIRMATION(EngagementLevel.MEDIUM),
    MINIMAL(EngagementLevel.LOW),
    CONFUSED(EngagementLevel.LOW),
    DISENGAGED(EngagementLevel.CRITICAL),
    SILENCE(EngagementLevel.CRITICAL);

    private final EngagementLevel level;

    EngagementType(EngagementLevel level) {
        this.level = level;
    }

    public EngagementLevel getLevel() {
        return level;
    }

    public boolean isMinimal() {
        return this == MINIMAL || this == MINIMAL_CONFIRMATION;
    }

    public boolean isNonResponse() {
        return this == DISENGAGED || this == SILENCE;
    }
}
