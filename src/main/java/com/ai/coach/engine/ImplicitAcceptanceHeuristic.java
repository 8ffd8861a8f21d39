package com.ai.coach.engine;

import com.ai.coach.conversation.Exchange;
import com.ai.coach.conversation.SessionState;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Treats repeated emotional or bodily language after the vision was offered as
 * acceptance of it. This is a policy choice, not a proven signal of consent, so it
 * is isolated here and can be switched off with
 * {@code coach.engine.implicit-acceptance-enabled=false}.
 * <p>
 * Rule: among the last three user turns that came after the goal turn, at least two
 * use emotional or body language and none rejects the vision outright.
 */
@Component
public class ImplicitAcceptanceHeuristic {

    static final int WINDOW = 3;
    static final int REQUIRED = 2;

    public Result evaluate(SessionState state, String currentText) {
        int goalTurn = state.getGoalTurn();
        if (goalTurn < 0) {
            return Result.rejected();
        }
        List<String> candidates = new ArrayList<>();
        for (Exchange e : state.getConversationHistory()) {
            if (e.getTurn() > goalTurn) {
                candidates.add(e.getInput());
            }
        }
        if (state.currentTurn() > goalTurn) {
            candidates.add(currentText);
        }
        List<String> window = candidates.subList(Math.max(0, candidates.size() - WINDOW), candidates.size());

        List<String> evidence = new ArrayList<>();
        for (String text : window) {
            if (SignalLexicon.matches(SignalLexicon.EXPLICIT_REJECTION, text)) {
                return Result.rejected();
            }
            if (SignalLexicon.matches(SignalLexicon.IMPLICIT_ACCEPTANCE_LANGUAGE, text)) {
                evidence.add(text);
            }
        }
        return evidence.size() >= REQUIRED ? new Result(true, evidence) : Result.rejected();
    }

    @Value
    public static class Result {
        boolean accepted;
        List<String> evidence;

        static Result rejected() {
            return new Result(false, List.of());
        }
    }
}
