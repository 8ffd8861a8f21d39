package com.ai.coach.engine;

import com.ai.coach.dto.NavigationDecision;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One rung of the override ladder: a condition and the decision it forces.
 * Actions may mutate the session state; conditions must not.
 */
final class NavigationRule {

    private final String name;
    private final Predicate<TurnContext> condition;
    private final Function<TurnContext, NavigationDecision.NavigationDecisionBuilder> action;

    NavigationRule(String name, Predicate<TurnContext> condition,
                   Function<TurnContext, NavigationDecision.NavigationDecisionBuilder> action) {
        this.name = name;
        this.condition = condition;
        this.action = action;
    }

    String name() {
        return name;
    }

    boolean applies(TurnContext context) {
        return condition.test(context);
    }

    NavigationDecision fire(TurnContext context) {
        return action.apply(context)
                .appliedRule(name)
                .ruleOverrideApplied(true)
                .fallbackUsed(false)
                .build();
    }
}
