package com.ai.coach.conversation;

/**
 * How engaged the client was on one turn.
 */
public enum EngagementLevel {
    HIGH,
    MEDIUM,
    LOW,
    CRITICAL;

    public boolean isLowOrWorse() {
        return this == LOW || this == CRITICAL;
    }
}
