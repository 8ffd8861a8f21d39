package com.ai.coach.engine;

/**
 * Result of yes/no classification of a user reply.
 */
public enum Affirmation {
    YES,
    NO,
    UNKNOWN
}
