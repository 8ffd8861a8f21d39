package com.ai.coach.engine;

import com.ai.coach.conversation.Criterion;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.Substate;
import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.SafetyFlags;

/**
 * Inputs visible to the rule ladder for one turn.
 */
final class TurnContext {

    private final String rawInput;
    private final String text;
    private final ClassifiedInput classified;
    private final SafetyFlags flags;
    private final TurnSignals signals;
    private final EngagementAssessment engagement;
    private final SessionState state;

    TurnContext(String rawInput, String text, ClassifiedInput classified, SafetyFlags flags,
                TurnSignals signals, EngagementAssessment engagement, SessionState state) {
        this.rawInput = rawInput;
        this.text = text;
        this.classified = classified;
        this.flags = flags;
        this.signals = signals;
        this.engagement = engagement;
        this.state = state;
    }

    String rawInput() {
        return rawInput;
    }

    String text() {
        return text;
    }

    ClassifiedInput classified() {
        return classified;
    }

    SafetyFlags flags() {
        return flags;
    }

    TurnSignals signals() {
        return signals;
    }

    EngagementAssessment engagement() {
        return engagement;
    }

    SessionState state() {
        return state;
    }

    Substate substate() {
        return state.getSubstate();
    }

    boolean in(Substate substate) {
        return state.getSubstate() == substate;
    }

    boolean met(Criterion criterion) {
        return state.isMet(criterion);
    }
}
