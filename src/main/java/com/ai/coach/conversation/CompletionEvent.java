package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.Getter;

/**
 * Audit entry: a criterion was met or the substate moved.
 */
@Getter
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class CompletionEvent {

    private String event;
    private int turn;

    private CompletionEvent() {
    }

    public CompletionEvent(String event, int turn) {
        this.event = event;
        this.turn = turn;
    }
}
