package com.ai.coach.engine;

import com.ai.coach.conversation.EngagementLevel;
import com.ai.coach.conversation.EngagementType;
import lombok.Builder;
import lombok.Value;

/**
 * Engagement reading for the current turn.
 */
@Value
@Builder
public class EngagementAssessment {

    public static final String DISENGAGEMENT_CHECK = "disengagement_check";
    public static final String ENGAGEMENT_CHECK = "engagement_check";

    EngagementType type;
    EngagementLevel level;
    /** Check-in to make this turn, or null when none is due. */
    String intervention;
    boolean handoffRecommended;

    public boolean needsIntervention() {
        return intervention != null;
    }

    static EngagementAssessment none() {
        return EngagementAssessment.builder()
                .type(EngagementType.ANSWERED)
                .level(EngagementLevel.HIGH)
                .build();
    }
}
