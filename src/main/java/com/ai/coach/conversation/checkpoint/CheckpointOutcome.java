package com.ai.coach.conversation.checkpoint;

import lombok.Value;

/**
 * Result of feeding one reply into a {@link CheckpointSequence}.
 */
@Value
public class CheckpointOutcome {

    public enum Kind {
        ADVANCED,
        COMPLETED,
        RESISTANCE,
        RETRY,
        CLARIFY
    }

    Kind kind;
    CheckpointReply reply;
    /** Zero-based step the user is on after this reply. */
    int stepIndex;
    CheckpointStep step;
}
