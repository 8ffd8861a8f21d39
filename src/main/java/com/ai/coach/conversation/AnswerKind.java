package com.ai.coach.conversation;

/**
 * What kind of contribution the user's most recent turn was.
 */
public enum AnswerKind {
    BODY_LOCATION,
    SENSATION_QUALITY,
    EMOTION,
    GOAL_STATEMENT,
    AFFIRMATION,
    CONFUSION,
    NOTHING_MORE,
    GENERAL;

    public boolean isBodyDetail() {
        return this == BODY_LOCATION || this == SENSATION_QUALITY;
    }
}
