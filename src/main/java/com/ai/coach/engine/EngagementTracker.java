package com.ai.coach.engine;

import com.ai.coach.conversation.AnswerKind;
import com.ai.coach.conversation.EngagementLog;
import com.ai.coach.conversation.EngagementType;
import com.ai.coach.conversation.SessionState;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Watches how the client answers rather than what they say. Short replies, non-answers
 * and confusion are counted per session; enough of them calls for a check-in, and a
 * sustained pattern recommends handing the client on to human support.
 */
@Component
public class EngagementTracker {

    private static final Logger log = LoggerFactory.getLogger(EngagementTracker.class);

    private static final List<String> MINIMAL_PHRASES = List.of(
            "yes", "yeah", "yep", "ok", "okay", "sure", "right", "that's right", "makes sense", "got it",
            "uh huh", "mm hmm", "exactly", "absolutely", "correct", "true", "i see", "alright"
    );
    private static final List<String> CONFUSION_PHRASES = List.of(
            "i don't know", "not sure", "don't understand", "what do you mean", "confused",
            "i don't get it", "can you explain"
    );
    private static final Set<String> CONFUSION_EXACT = Set.of("huh", "what", "huh?", "what?");
    private static final Set<String> DISENGAGED_EXACT = Set.of("...", ".", "k", "whatever", "fine", "idk");
    private static final Set<AnswerKind> ANSWER_KINDS = EnumSet.of(
            AnswerKind.GOAL_STATEMENT, AnswerKind.EMOTION, AnswerKind.BODY_LOCATION,
            AnswerKind.SENSATION_QUALITY, AnswerKind.NOTHING_MORE);

    private static final int ENGAGED_WORDS = 10;
    private static final int MODERATE_WORDS = 5;
    private static final int MINIMAL_CONFIRMATION_WORDS = 3;

    private static final int NON_RESPONSES_FOR_CHECK = 2;
    private static final int MINIMAL_STREAK_FOR_CHECK = 4;
    private static final int TURNS_BETWEEN_CHECKS = 3;

    private static final int NON_RESPONSES_FOR_HANDOFF = 3;
    private static final int CONFUSION_FOR_HANDOFF = 5;
    private static final int LOW_LEVELS_FOR_HANDOFF = 7;

    /** Classifies the reply, updates the session's counters and returns what is due. */
    public EngagementAssessment assess(SessionState state, String text, AnswerKind answerKind) {
        EngagementType type = classify(text, answerKind);
        EngagementLog engagement = state.getEngagement();
        engagement.record(type);

        String intervention = null;
        if (type.isNonResponse() && engagement.getConsecutiveNonResponses() >= NON_RESPONSES_FOR_CHECK) {
            intervention = EngagementAssessment.DISENGAGEMENT_CHECK;
        } else if (engagement.getConsecutiveMinimal() >= MINIMAL_STREAK_FOR_CHECK
                && engagement.turnsSinceIntervention(state.currentTurn()) >= TURNS_BETWEEN_CHECKS) {
            intervention = EngagementAssessment.ENGAGEMENT_CHECK;
        }

        boolean handoff = engagement.getConsecutiveNonResponses() >= NON_RESPONSES_FOR_HANDOFF
                || engagement.getConfusionCount() >= CONFUSION_FOR_HANDOFF
                || engagement.lowLevelCount() >= LOW_LEVELS_FOR_HANDOFF;
        if (handoff) {
            log.warn("[{}] Sustained low engagement, hand-off recommended (nonResponses={}, confusion={}, low={})",
                    state.getSessionId(), engagement.getConsecutiveNonResponses(), engagement.getConfusionCount(),
                    engagement.lowLevelCount());
        }
        return EngagementAssessment.builder()
                .type(type)
                .level(type.getLevel())
                .intervention(intervention)
                .handoffRecommended(handoff)
                .build();
    }

    public EngagementType classify(String text, AnswerKind answerKind) {
        String t = StringUtils.normalizeSpace(StringUtils.defaultString(text)).toLowerCase(Locale.ROOT);
        if (t.isEmpty()) {
            return EngagementType.SILENCE;
        }
        if (CONFUSION_EXACT.contains(t) || CONFUSION_PHRASES.stream().anyMatch(t::contains)) {
            return EngagementType.CONFUSED;
        }
        if (DISENGAGED_EXACT.contains(t)) {
            return EngagementType.DISENGAGED;
        }
        if (answerKind != null && ANSWER_KINDS.contains(answerKind)) {
            return EngagementType.ANSWERED;
        }
        int words = SignalLexicon.wordCount(t);
        if (startsWithMinimalPhrase(t)) {
            return words <= MINIMAL_CONFIRMATION_WORDS
                    ? EngagementType.MINIMAL_CONFIRMATION
                    : EngagementType.CONFIRMATION_WITH_CONTENT;
        }
        if (words >= ENGAGED_WORDS) {
            return EngagementType.ENGAGED;
        }
        if (words >= MODERATE_WORDS) {
            return EngagementType.MODERATE;
        }
        return EngagementType.MINIMAL;
    }

    private static boolean startsWithMinimalPhrase(String text) {
        for (String phrase : MINIMAL_PHRASES) {
            if (text.equals(phrase) || text.startsWith(phrase + " ") || text.startsWith(phrase + ",")
                    || text.startsWith(phrase + ".") || text.startsWith(phrase + "!")) {
                return true;
            }
        }
        return false;
    }
}
