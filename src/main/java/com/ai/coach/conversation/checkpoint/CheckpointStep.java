package com.ai.coach.conversation.checkpoint;

/**
 * Physical relaxation instructions, issued in this order. Sequences longer than
 * three steps cycle through them again.
 */
public enum CheckpointStep {
    LOWER_JAW,
    RELAX_TONGUE,
    BREATHE_SLOWER
}
