package com.ai.coach.conversation.checkpoint;

/**
 * Down-regulation cues observed in calm replies.
 */
public enum PhysiologicalIndicator {
    SLOW_DEEP_BREATH(true),
    LONGER_EXHALE(true),
    SOFTENING(true),
    /** Recorded for the summary but not a bodily cue. */
    VERBAL_CONFIRMATION(false);

    private final boolean physiological;

    PhysiologicalIndicator(boolean physiological) {
        this.physiological = physiological;
    }

    public boolean isPhysiological() {
        return physiological;
    }
}
