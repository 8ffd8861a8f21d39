package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import lombok.Getter;

import java.time.Instant;

/**
 * One user turn and the assistant reply it produced.
 */
@Getter
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Exchange {

    private int turn;
    private Instant timestamp;
    private String input;
    private String output;
    private Substate substateAtTime;
    private String action;

    private Exchange() {
    }

    public Exchange(int turn, Instant timestamp, String input, String output, Substate substateAtTime, String action) {
        this.turn = turn;
        this.timestamp = timestamp;
        this.input = input;
        this.output = output;
        this.substateAtTime = substateAtTime;
        this.action = action;
    }
}
