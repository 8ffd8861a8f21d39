package com.ai.coach.engine;

import com.ai.coach.conversation.SessionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImplicitAcceptanceHeuristicTest {

    private final ImplicitAcceptanceHeuristic heuristic = new ImplicitAcceptanceHeuristic();
    private SessionState state;

    @BeforeEach
    void setUp() {
        state = new SessionState("implicit");
    }

    @Test
    @DisplayName("nothing to accept before a goal was stated")
    void noGoal() {
        state.appendExchange("my chest is heavy", "Okay.", "general_inquiry");
        assertFalse(heuristic.evaluate(state, "I feel sad").isAccepted());
    }

    @Test
    @DisplayName("two emotional replies after the goal count as acceptance")
    void acceptedWithEvidence() {
        state.recordGoalTurn();
        state.appendExchange("I want to feel calm", "Does that make sense to you?", "build_vision");
        state.appendExchange("my chest is heavy", "Does that make sense to you?", "build_vision");

        ImplicitAcceptanceHeuristic.Result result = heuristic.evaluate(state, "I just feel sad");

        assertTrue(result.isAccepted());
        assertEquals(2, result.getEvidence().size());
    }

    @Test
    @DisplayName("the goal turn itself is not evidence")
    void goalTurnExcluded() {
        state.recordGoalTurn();
        state.appendExchange("I want to feel better", "Does that make sense to you?", "build_vision");
        assertFalse(heuristic.evaluate(state, "my chest is tight").isAccepted());
    }

    @Test
    @DisplayName("an outright rejection in the window wins")
    void rejectionWins() {
        state.recordGoalTurn();
        state.appendExchange("I want to feel calm", "Does that make sense to you?", "build_vision");
        state.appendExchange("my chest is heavy", "Does that make sense to you?", "build_vision");
        state.appendExchange("no, that's not it", "Let me put it another way.", "build_vision");

        assertFalse(heuristic.evaluate(state, "I feel sad").isAccepted());
    }
}
