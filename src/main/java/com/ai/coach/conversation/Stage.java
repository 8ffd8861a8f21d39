package com.ai.coach.conversation;

/**
 * Coarse session phase, derived from the current {@link Substate}.
 */
public enum Stage {
    SAFETY_BUILDING,
    DOWN_REGULATION,
    CLOSED
}
