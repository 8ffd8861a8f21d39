package com.ai.coach.service;

import com.ai.coach.component.ResponsePhrases;
import com.ai.coach.conversation.QuestionText;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.checkpoint.CheckpointStep;
import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns a navigation decision into the coach's reply text.
 * No navigation logic, only action + payload to wording. Where an action has several
 * wordings, the first one whose questions were not asked in the last few turns wins.
 */
@Service
public class ResponseComposer {

    private final ResponsePhrases phrases;
    private final int repeatWindow;

    public ResponseComposer(ResponsePhrases phrases,
                            @Value("${coach.composer.repeat-window:5}") int repeatWindow) {
        this.phrases = phrases;
        this.repeatWindow = repeatWindow;
    }

    public String compose(NavigationDecision decision, SessionState state, List<RetrievedExample> examples) {
        if (decision == null || decision.getAction() == null)
            return "";
        switch (decision.getAction()) {
            case SAFETY_ESCALATION:
                return phrases.safetyEscalation();
            case REDIRECT_PAST:
                return pick(state, phrases.redirectPast());
            case REDIRECT_THINKING:
                return pick(state, phrases.redirectThinking());
            case OFFER_OUTCOME_MENU:
                return pick(state, phrases.outcomeMenu(decision.getString("context"), decision.getString("goal")));
            case CLARIFY_GOAL:
                if ("redirect_outcome".equals(decision.getString("variant")))
                    return pick(state, phrases.redirectOutcome());
                return pick(state, phrases.clarifyGoal());
            case BUILD_VISION:
                return pick(state, phrases.vision(decision.getString("goal"), decision.getFlag("repeat")));
            case PROVIDE_PSYCHO_EDUCATION:
                return pick(state, phrases.psychoEducation(state.getSessionId().hashCode()));
            case EXPLORE_PROBLEM:
                return pick(state, phrases.exploreProblem());
            case BODY_AWARENESS_INQUIRY:
                return affirmed(decision, state, pick(state, phrases.locationQuestions(locationCue(decision))));
            case BODY_SENSATION_INQUIRY:
                return affirmed(decision, state, pick(state, phrases.sensationQuestions(decision.getString("location"))));
            case PRESENT_MOMENT_INQUIRY:
                if ("readiness_escape".equals(decision.getString("variant")))
                    return pick(state, phrases.readinessEscape());
                return affirmed(decision, state, pick(state, phrases.presentMoment()));
            case ASK_WHAT_ELSE:
                return affirmed(decision, state, pick(state, phrases.whatElse()));
            case PATTERN_INQUIRY:
                return pick(state, phrases.patternInquiry());
            case ASSESS_READINESS:
                return pick(state, phrases.assessReadiness());
            case REQUEST_ALPHA_PERMISSION:
                return pick(state, phrases.requestPermission());
            case REASSURE_ALPHA_PERMISSION:
                return pick(state, phrases.reassurePermission());
            case CHECKPOINT_INSTRUCTION:
                return checkpointStep(decision, state,
                        decision.getFlag("first") ? phrases.beginSequence() : affirmation(state));
            case NORMALIZE_RESISTANCE:
                return checkpointStep(decision, state, phrases.normalizeResistance());
            case RETRY_CHECKPOINT:
                return phrases.giveItAMoment() + " " + pick(state, phrases.checkpointQuestions());
            case CLARIFY_CHECKPOINT:
                return phrases.checkpointClarify() + " " + pick(state, phrases.checkpointQuestions());
            case SEQUENCE_COMPLETE:
                return phrases.sequenceComplete(decision.getFlag("downRegulated"));
            case SESSION_CLOSED:
                return phrases.sessionClosed();
            case ENGAGEMENT_CHECK:
                return engagementCheck(decision, state);
            case CLARIFY_CONFUSION:
                return pick(state, phrases.clarifyConfusion());
            case GENERAL_INQUIRY:
            default:
                return generalInquiry(state, examples);
        }
    }

    /** Opening line for a fresh session. */
    public String opening() {
        return phrases.opening();
    }

    private String checkpointStep(NavigationDecision decision, SessionState state, String lead) {
        CheckpointStep step = CheckpointStep.valueOf(
                StringUtils.defaultIfBlank(decision.getString("step"), CheckpointStep.LOWER_JAW.name()));
        return lead + " " + phrases.instruction(step) + " " + pick(state, phrases.checkpointQuestions());
    }

    private String engagementCheck(NavigationDecision decision, SessionState state) {
        String check = pick(state, phrases.engagementCheck(decision.getString("intervention")));
        if (!decision.getFlag("handoffRecommended"))
            return check;
        return phrases.handoffSuggestion() + " " + check;
    }

    private String generalInquiry(SessionState state, List<RetrievedExample> examples) {
        if (examples != null) {
            for (RetrievedExample example : examples) {
                if (!recentlyAsked(state, example.getText()))
                    return example.getText();
            }
        }
        return pick(state, phrases.generalInquiry());
    }

    private static String locationCue(NavigationDecision decision) {
        String cue = decision.getString("emotion");
        if (cue == null)
            cue = decision.getString("sensation");
        if (cue == null)
            cue = decision.getString("topic");
        return cue;
    }

    private String affirmed(NavigationDecision decision, SessionState state, String question) {
        if (!decision.getFlag("affirm"))
            return question;
        return affirmation(state) + " " + question;
    }

    private String affirmation(SessionState state) {
        List<String> pool = phrases.affirmations();
        return pool.get(Math.floorMod(state.currentTurn(), pool.size()));
    }

    /**
     * First variant, starting from a turn-based offset, that was not asked within the
     * repeat window. When all of them were, a holding statement without a question is
     * used instead, so no question is repeated inside the window.
     */
    String pick(SessionState state, List<String> pool) {
        int offset = Math.floorMod(state.currentTurn(), pool.size());
        for (int i = 0; i < pool.size(); i++) {
            String candidate = pool.get((offset + i) % pool.size());
            if (!recentlyAsked(state, candidate))
                return candidate;
        }
        List<String> holding = phrases.holdingStatements();
        return holding.get(Math.floorMod(state.currentTurn(), holding.size()));
    }

    private boolean recentlyAsked(SessionState state, String text) {
        for (String question : QuestionText.extractQuestions(text)) {
            if (state.askedWithin(question, repeatWindow))
                return true;
        }
        return false;
    }
}
