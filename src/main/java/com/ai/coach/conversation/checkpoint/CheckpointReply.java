package com.ai.coach.conversation.checkpoint;

/**
 * Classification of a reply to the "more tense or more calm?" question.
 */
public enum CheckpointReply {
    CALM,
    TENSE,
    NEUTRAL,
    UNRECOGNIZED
}
