package com.ai.coach.engine;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies replies into YES, NO or UNKNOWN. Replies mixing agreement and
 * refusal ("yes but no") are UNKNOWN so they never count as consent.
 */
@Component
public class AffirmationClassifier {

    private static final Set<String> AFFIRMATIVE_EXACT = Set.of(
            "yes", "yeah", "yep", "ya", "yup", "uh huh", "uh-huh", "ok", "okay",
            "sure", "correct", "absolutely", "definitely", "exactly", "mm hmm", "i am", "i'm ready"
    );

    private static final Set<String> NEGATIVE_EXACT = Set.of(
            "no", "nope", "nah", "not now", "not yet", "wait", "hold on", "i'm not", "not really"
    );

    private static final Pattern AFFIRMATIVE_PATTERN = Pattern.compile(
            "\\b(yes|yeah|yep|ya|yup|ok|okay|sure|correct|absolutely|definitely|alright|go ahead)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEGATIVE_PATTERN = Pattern.compile(
            "\\b(no|nope|nah|don't|dont|not now|not yet|not sure|unsure|not really|wait|hold on|not ready|rather not)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public Affirmation classify(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            return Affirmation.UNKNOWN;
        }
        String normalized = userInput.trim().toLowerCase().replaceAll("[.!,]+$", "");

        if (normalized.length() <= 15) {
            if (AFFIRMATIVE_EXACT.contains(normalized)) {
                return Affirmation.YES;
            }
            if (NEGATIVE_EXACT.contains(normalized)) {
                return Affirmation.NO;
            }
        }

        boolean affirmative = AFFIRMATIVE_PATTERN.matcher(normalized).find();
        boolean negative = NEGATIVE_PATTERN.matcher(normalized).find();
        if (affirmative && negative) {
            return Affirmation.UNKNOWN;
        }
        if (affirmative) {
            return Affirmation.YES;
        }
        if (negative) {
            return Affirmation.NO;
        }
        return Affirmation.UNKNOWN;
    }

    public boolean isAffirmative(String userInput) {
        return classify(userInput) == Affirmation.YES;
    }

    public boolean isNegative(String userInput) {
        return classify(userInput) == Affirmation.NO;
    }
}
