package com.ai.coach.engine;

import com.ai.coach.conversation.AnswerKind;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * What the detectors found in the current user turn.
 */
@Value
@Builder
public class TurnSignals {

    AnswerKind answerKind;
    boolean mentionsLocation;
    boolean mentionsSensation;
    boolean problemTalk;
    /** Stressor and emotion keywords in this turn. */
    Set<String> topics;
    /** Topics not explored before this turn. */
    Set<String> newTopics;
    int wordCount;

    public boolean isBodyDisclosure() {
        return mentionsLocation || mentionsSensation;
    }
}
