package com.ai.coach.engine;

import com.ai.coach.conversation.AnswerKind;
import com.ai.coach.conversation.Criterion;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.Substate;
import com.ai.coach.dto.NavigationAction;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Reads the current user turn and records what it establishes: the answer kind,
 * body-enquiry captures and every completion criterion it satisfies.
 * All detectors are idempotent; criteria already met are left alone.
 */
@Component
public class SessionSignalDetector {

    private static final Logger log = LoggerFactory.getLogger(SessionSignalDetector.class);

    private static final int PROBLEM_EVIDENCE_WINDOW = 5;
    private static final int PROBLEM_EVIDENCE_REQUIRED = 2;
    private static final int PROBLEM_MIN_TURNS_IN_SUBSTATE = 3;
    private static final int PATTERN_MIN_WORDS = 10;

    private final AffirmationClassifier affirmationClassifier;
    private final ImplicitAcceptanceHeuristic implicitAcceptance;
    private final EngineSettings settings;

    public SessionSignalDetector(AffirmationClassifier affirmationClassifier,
                                 ImplicitAcceptanceHeuristic implicitAcceptance,
                                 EngineSettings settings) {
        this.affirmationClassifier = affirmationClassifier;
        this.implicitAcceptance = implicitAcceptance;
        this.settings = settings;
    }

    public TurnSignals update(SessionState state, String text) {
        AnswerKind kind = detectAnswerKind(text);
        boolean location = SignalLexicon.matches(SignalLexicon.BODY_LOCATION, text);
        boolean sensation = SignalLexicon.matches(SignalLexicon.SENSATION, text);
        int words = SignalLexicon.wordCount(text);

        Set<String> topics = new LinkedHashSet<>(SignalLexicon.allMatches(SignalLexicon.STRESSOR, text));
        topics.addAll(SignalLexicon.allMatches(SignalLexicon.EMOTION, text));
        Set<String> newTopics = new LinkedHashSet<>(topics);
        newTopics.removeAll(state.getCoveredTopics());

        Substate substate = state.getSubstate();
        boolean bodyPhase = substate.isAtLeast(Substate.PSYCHO_EDUCATION)
                && !substate.isAtLeast(Substate.READINESS_ASSESSMENT);

        if (bodyPhase) {
            if (state.lastActionWas(NavigationAction.ASK_WHAT_ELSE.getCode()) && kind != AnswerKind.NOTHING_MORE
                    && state.getBodyEnquiryCycles() < settings.getBodyEnquiryCycleCap()) {
                state.startNewBodyCycle();
            }
            if (location) state.captureLocation();
            if (sensation) state.captureSensation();
            state.coverTopics(topics);
        }

        detectGoal(state, text);
        detectVisionAcceptance(state, text);
        if (substate.isAtLeast(Substate.PSYCHO_EDUCATION)) {
            detectProblemPhase(state, text, location, sensation, words);
        }
        if (substate.isAtLeast(Substate.PROBLEM_AND_BODY) && words > PATTERN_MIN_WORDS
                && SignalLexicon.matches(SignalLexicon.PATTERN_PHRASE, text)) {
            state.markCriterion(Criterion.PATTERN_UNDERSTOOD, text);
        }
        if (substate == Substate.READINESS_ASSESSMENT
                && (kind == AnswerKind.NOTHING_MORE || readinessPhrase(text))) {
            state.markCriterion(Criterion.READINESS_CONFIRMED, text);
        }
        if (substate == Substate.ALPHA_PERMISSION
                && (affirmationClassifier.isAffirmative(text) || readinessPhrase(text))) {
            state.markCriterion(Criterion.ALPHA_PERMISSION_GRANTED, text);
        }

        state.setLastAnswerKind(kind);
        log.debug("[{}] answerKind={} location={} sensation={} topics={} criteria={}",
                state.getSessionId(), kind, location, sensation, topics, state.getCompletion().asMap());

        return TurnSignals.builder()
                .answerKind(kind)
                .mentionsLocation(location)
                .mentionsSensation(sensation)
                .problemTalk(SignalLexicon.matches(SignalLexicon.PROBLEM_TALK, text))
                .topics(topics)
                .newTopics(newTopics)
                .wordCount(words)
                .build();
    }

    public AnswerKind detectAnswerKind(String text) {
        if (StringUtils.isBlank(text)) {
            return AnswerKind.GENERAL;
        }
        if (SignalLexicon.matches(SignalLexicon.EMOTION, text)) return AnswerKind.EMOTION;
        if (SignalLexicon.matches(SignalLexicon.BODY_LOCATION, text)) return AnswerKind.BODY_LOCATION;
        if (SignalLexicon.matches(SignalLexicon.SENSATION, text)) return AnswerKind.SENSATION_QUALITY;
        if (SignalLexicon.matches(SignalLexicon.GOAL_PHRASE, text)) return AnswerKind.GOAL_STATEMENT;
        if (SignalLexicon.matches(SignalLexicon.NOTHING_MORE, text)) return AnswerKind.NOTHING_MORE;
        if (SignalLexicon.matches(SignalLexicon.CONFUSION, text)) return AnswerKind.CONFUSION;
        if (affirmationClassifier.isAffirmative(text)) return AnswerKind.AFFIRMATION;
        return AnswerKind.GENERAL;
    }

    private void detectGoal(SessionState state, String text) {
        if (state.isMet(Criterion.GOAL_STATED)) {
            return;
        }
        boolean phrase = SignalLexicon.matches(SignalLexicon.GOAL_PHRASE, text);
        boolean goalWord = state.getSubstate() == Substate.GOAL_AND_VISION
                && SignalLexicon.matches(SignalLexicon.GOAL_STATE, text);
        if (phrase || goalWord) {
            state.markCriterion(Criterion.GOAL_STATED, extractGoal(text));
            state.recordGoalTurn();
        }
    }

    private void detectVisionAcceptance(SessionState state, String text) {
        if (!state.isMet(Criterion.GOAL_STATED) || !state.isMet(Criterion.VISION_PRESENTED)
                || state.isMet(Criterion.VISION_ACCEPTED)) {
            return;
        }
        boolean agrees = affirmationClassifier.isAffirmative(text)
                || SignalLexicon.matches(SignalLexicon.VISION_ACCEPT, text);
        if (agrees && !SignalLexicon.matches(SignalLexicon.NEGATION, text)) {
            state.markCriterion(Criterion.VISION_ACCEPTED, text);
            return;
        }
        if (settings.isImplicitAcceptanceEnabled()) {
            ImplicitAcceptanceHeuristic.Result implicit = implicitAcceptance.evaluate(state, text);
            if (implicit.isAccepted()) {
                log.info("[{}] Vision accepted implicitly, evidence={}", state.getSessionId(), implicit.getEvidence());
                state.markCriterion(Criterion.VISION_ACCEPTED, "implicit: " + String.join(" | ", implicit.getEvidence()));
            }
        }
    }

    private void detectProblemPhase(SessionState state, String text, boolean location, boolean sensation, int words) {
        if (!state.isMet(Criterion.PROBLEM_IDENTIFIED) && problemEvidence(state, text, words)) {
            state.markCriterion(Criterion.PROBLEM_IDENTIFIED, text);
        }
        String emotion = SignalLexicon.firstMatch(SignalLexicon.EMOTION, text);
        if (emotion != null) {
            state.markCriterion(Criterion.EMOTION_IDENTIFIED, emotion);
        }
        if (location || sensation || SignalLexicon.matches(SignalLexicon.BODY_AWARENESS, text)) {
            state.markCriterion(Criterion.BODY_AWARENESS_PRESENT, text);
        }
        if (SignalLexicon.matches(SignalLexicon.PRESENT_MOMENT, text)) {
            state.markCriterion(Criterion.PRESENT_MOMENT_FOCUS, text);
        }
    }

    private boolean problemEvidence(SessionState state, String text, int words) {
        if (SignalLexicon.matches(SignalLexicon.STRESSOR, text)) {
            return true;
        }
        if (words > 3 && SignalLexicon.matches(SignalLexicon.PROBLEM_STATEMENT, text)) {
            return true;
        }
        List<String> recent = state.recentInputs(PROBLEM_EVIDENCE_WINDOW - 1);
        recent.add(text);
        long withEvidence = recent.stream().filter(SessionSignalDetector::stressorOrBody).count();
        if (withEvidence >= PROBLEM_EVIDENCE_REQUIRED) {
            return true;
        }
        return state.getSubstate() == Substate.PROBLEM_AND_BODY
                && state.turnsInSubstate() >= PROBLEM_MIN_TURNS_IN_SUBSTATE
                && state.isLocationCaptured() && state.isSensationCaptured();
    }

    private static boolean stressorOrBody(String text) {
        return SignalLexicon.matches(SignalLexicon.STRESSOR, text)
                || SignalLexicon.matches(SignalLexicon.BODY_LOCATION, text)
                || SignalLexicon.matches(SignalLexicon.SENSATION, text);
    }

    private boolean readinessPhrase(String text) {
        return SignalLexicon.matches(SignalLexicon.READINESS, text)
                && !SignalLexicon.matches(SignalLexicon.NEGATION, text);
    }

    static String extractGoal(String text) {
        String state = SignalLexicon.firstMatch(SignalLexicon.GOAL_STATE, text);
        if (state != null) {
            return state;
        }
        Matcher m = SignalLexicon.GOAL_PHRASE.matcher(text);
        if (m.find()) {
            String rest = text.substring(m.end()).replaceAll("[.!?,]", " ").trim();
            String[] words = rest.split("\\s+");
            if (words.length > 0 && !words[0].isEmpty()) {
                return String.join(" ", Arrays.copyOf(words, Math.min(words.length, 6)));
            }
        }
        return text.trim();
    }
}
