package com.ai.coach.engine;

import com.ai.coach.conversation.AnswerKind;
import com.ai.coach.conversation.Criterion;
import com.ai.coach.conversation.Exchange;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.Substate;
import com.ai.coach.conversation.checkpoint.CheckpointOutcome;
import com.ai.coach.conversation.checkpoint.CheckpointSequence;
import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.GenerativeDecision;
import com.ai.coach.dto.NavigationAction;
import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.PromptContext;
import com.ai.coach.dto.SafetyFlags;
import com.ai.coach.exception.CoachException;
import com.ai.coach.exception.MalformedGenerativeResponseException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides what the assistant attempts next. Rules run first, in fixed priority order,
 * and the generative service is consulted only when none of them fires. Whatever the
 * generative service suggests is checked against the session's limits, and any failure
 * there falls back to a local default, so every turn produces a complete decision.
 */
@Service
public class NavigationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(NavigationDecisionEngine.class);

    static final String RULE_GENERATIVE = "generative";
    static final String RULE_DEFAULT = "default";

    private static final int PROMPT_EXCHANGES = 3;

    /** Decisions the generative service may choose from. */
    private static final Set<NavigationAction> GENERATIVE_ACTIONS = EnumSet.of(
            NavigationAction.CLARIFY_GOAL,
            NavigationAction.BUILD_VISION,
            NavigationAction.EXPLORE_PROBLEM,
            NavigationAction.BODY_AWARENESS_INQUIRY,
            NavigationAction.PATTERN_INQUIRY,
            NavigationAction.ASSESS_READINESS,
            NavigationAction.GENERAL_INQUIRY
    );

    private static final Pattern FEELINGS_CONTEXT = Pattern.compile("\\b(feel|feeling|feelings|emotion)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GOAL_CONTEXT = Pattern.compile("\\b(want|goal|hope|wish)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BODY_CONTEXT = Pattern.compile("\\b(body|sensation|physically)\\b",
            Pattern.CASE_INSENSITIVE);

    private enum BodyStep {
        WHAT_ELSE,
        ASK_SENSATION,
        ASK_LOCATION_FOR_SENSATION,
        ASK_PRESENT_MOMENT,
        ASK_LOCATION_FOR_EMOTION,
        CLARIFY
    }

    private final SessionSignalDetector detector;
    private final EngagementTracker engagementTracker;
    private final GenerativeDecisionClient generativeClient;
    private final EngineSettings settings;
    private final List<NavigationRule> ladder;

    public NavigationDecisionEngine(SessionSignalDetector detector,
                                    EngagementTracker engagementTracker,
                                    GenerativeDecisionClient generativeClient,
                                    EngineSettings settings) {
        this.detector = detector;
        this.engagementTracker = engagementTracker;
        this.generativeClient = generativeClient;
        this.settings = settings;
        this.ladder = buildLadder();
    }

    private List<NavigationRule> buildLadder() {
        List<NavigationRule> rules = new ArrayList<>();
        rules.add(new NavigationRule("safety",
                c -> c.flags().isCrisis(),
                c -> base(NavigationAction.SAFETY_ESCALATION, "Crisis language detected, normal flow suspended")
                        .payloadEntry("noQuestion", true)));
        rules.add(new NavigationRule("body_question_cap",
                c -> c.in(Substate.PROBLEM_AND_BODY)
                        && c.state().getBodyQuestionsAsked() >= settings.getBodyQuestionCap(),
                this::escapeBodyQuestionCap));
        rules.add(new NavigationRule("redirect_past",
                c -> c.substate().isConversational() && c.flags().isPastTense(),
                c -> base(NavigationAction.REDIRECT_PAST, "Client is describing the past, bring focus to now")));
        rules.add(new NavigationRule("redirect_thinking",
                c -> c.substate().isConversational() && c.flags().isThinkingMode(),
                c -> base(NavigationAction.REDIRECT_THINKING, "Client is analysing, bring focus to feeling")));
        rules.add(new NavigationRule("uncertainty",
                c -> c.substate().isConversational() && c.flags().isUncertain(),
                c -> base(NavigationAction.OFFER_OUTCOME_MENU, "Client is unsure, offer outcome options")
                        .payloadEntry("context", uncertaintyContext(c))
                        .payloadEntry("goal", StringUtils.defaultString(
                                c.state().getCompletion().getEvidence(Criterion.GOAL_STATED)))));
        rules.add(new NavigationRule("engagement",
                c -> c.substate().isConversational() && c.engagement().needsIntervention(),
                this::engagementCheck));
        rules.add(new NavigationRule("clarify_goal",
                c -> c.in(Substate.GOAL_AND_VISION) && !c.met(Criterion.GOAL_STATED)
                        && c.state().getTurnCount() <= 2,
                c -> base(NavigationAction.CLARIFY_GOAL, "No goal stated yet")));
        rules.add(new NavigationRule("redirect_outcome",
                c -> c.in(Substate.GOAL_AND_VISION) && !c.met(Criterion.GOAL_STATED) && c.signals().isProblemTalk(),
                c -> base(NavigationAction.CLARIFY_GOAL, "Client describes a problem before naming an outcome")
                        .retrievalTag("redirect_outcome")
                        .payloadEntry("variant", "redirect_outcome")));
        rules.add(new NavigationRule("build_vision",
                c -> c.in(Substate.GOAL_AND_VISION) && c.met(Criterion.GOAL_STATED)
                        && !c.met(Criterion.VISION_ACCEPTED),
                this::buildVision));
        rules.add(new NavigationRule("psycho_education",
                c -> c.in(Substate.PSYCHO_EDUCATION) && !c.met(Criterion.PSYCHO_EDUCATION_PROVIDED),
                this::psychoEducation));
        rules.add(new NavigationRule("explore_problem",
                c -> c.in(Substate.PROBLEM_AND_BODY) && !c.met(Criterion.PROBLEM_IDENTIFIED)
                        && !c.signals().isBodyDisclosure()
                        && c.state().getProblemQuestionTurn() < 0,
                this::exploreProblem));
        rules.add(new NavigationRule("nothing_more_escape",
                c -> c.in(Substate.PROBLEM_AND_BODY)
                        && ((c.state().lastActionWas(NavigationAction.ASK_WHAT_ELSE.getCode())
                        && c.signals().getAnswerKind() == AnswerKind.NOTHING_MORE)
                        || c.state().getBodyEnquiryCycles() >= settings.getBodyEnquiryCycleCap()),
                this::escapeToReadiness));
        rules.add(new NavigationRule("readiness_reentry",
                c -> c.in(Substate.READINESS_ASSESSMENT)
                        && !c.signals().getNewTopics().isEmpty()
                        && c.state().getReentryCount() == 0
                        && c.state().getBodyEnquiryCycles() < settings.getBodyEnquiryCycleCap()
                        && c.state().getBodyQuestionsAsked() < settings.getBodyQuestionCap(),
                this::reenterBodyEnquiry));
        rules.add(new NavigationRule("assess_readiness",
                c -> c.in(Substate.READINESS_ASSESSMENT),
                this::assessReadiness));
        rules.add(new NavigationRule("alpha_permission",
                c -> c.in(Substate.ALPHA_PERMISSION),
                this::alphaPermission));
        rules.add(new NavigationRule("checkpoint",
                c -> c.in(Substate.ALPHA_SEQUENCE),
                this::checkpoint));
        rules.add(new NavigationRule("session_closed",
                c -> c.in(Substate.COMPLETE),
                c -> base(NavigationAction.SESSION_CLOSED, "Session complete")));
        rules.add(new NavigationRule("body_enquiry",
                c -> c.in(Substate.PROBLEM_AND_BODY) && pickBodyStep(c) != null,
                this::bodyEnquiry));
        return Collections.unmodifiableList(rules);
    }

    /**
     * Updates criteria, counters and substate for this turn and returns the decision.
     * If anything fails before a decision exists, the state is put back as it was.
     */
    public NavigationDecision decide(String rawInput, ClassifiedInput classified, SessionState state) {
        SessionState before = state.copy();
        try {
            return decideTurn(rawInput, classified, state);
        } catch (RuntimeException e) {
            state.restore(before);
            log.warn("[{}] Turn aborted, session state restored: {}", state.getSessionId(), e.getMessage());
            throw e;
        }
    }

    private NavigationDecision decideTurn(String rawInput, ClassifiedInput classified, SessionState state) {
        ClassifiedInput input = classified != null ? classified : ClassifiedInput.neutral(rawInput);
        SafetyFlags flags = input.getSafetyFlags() != null ? input.getSafetyFlags() : SafetyFlags.none();
        String text = StringUtils.defaultIfBlank(input.getCorrectedText(), StringUtils.defaultString(rawInput));

        TurnSignals signals;
        EngagementAssessment engagement;
        if (flags.isCrisis()) {
            signals = emptySignals();
            engagement = EngagementAssessment.none();
        } else {
            signals = detector.update(state, text);
            engagement = engagementTracker.assess(state, text, signals.getAnswerKind());
            advance(state);
        }

        TurnContext context = new TurnContext(rawInput, text, input, flags, signals, engagement, state);
        NavigationDecision decision = null;
        for (NavigationRule rule : ladder) {
            if (rule.applies(context)) {
                decision = rule.fire(context);
                log.info("[{}] Rule {} -> {}", state.getSessionId(), rule.name(), decision.getAction().getCode());
                break;
            }
        }
        if (decision == null) {
            decision = generativeDecision(context);
        }
        countBodyQuestion(context, decision);
        return finish(state, decision);
    }

    // ---- rule actions ----

    private NavigationDecision.NavigationDecisionBuilder escapeBodyQuestionCap(TurnContext c) {
        c.state().forceTransition(Substate.READINESS_ASSESSMENT, "body_question_cap");
        log.info("[{}] Body question cap reached ({}), moving to readiness",
                c.state().getSessionId(), c.state().getBodyQuestionsAsked());
        return base(NavigationAction.PRESENT_MOMENT_INQUIRY, "Body question cap reached")
                .retrievalTag(NavigationAction.ASSESS_READINESS.getRetrievalTag())
                .payloadEntry("variant", "readiness_escape");
    }

    private NavigationDecision.NavigationDecisionBuilder buildVision(TurnContext c) {
        boolean repeat = c.met(Criterion.VISION_PRESENTED);
        String goal = c.state().getCompletion().getEvidence(Criterion.GOAL_STATED);
        c.state().markCriterion(Criterion.VISION_PRESENTED, goal);
        return base(NavigationAction.BUILD_VISION, "Goal stated, vision not yet accepted")
                .payloadEntry("goal", StringUtils.defaultString(goal, "better"))
                .payloadEntry("repeat", repeat);
    }

    private NavigationDecision.NavigationDecisionBuilder psychoEducation(TurnContext c) {
        c.state().markCriterion(Criterion.PSYCHO_EDUCATION_PROVIDED, "stress response explained");
        return base(NavigationAction.PROVIDE_PSYCHO_EDUCATION, "Vision accepted, explain the stress response")
                .readyForNext(true);
    }

    private NavigationDecision.NavigationDecisionBuilder exploreProblem(TurnContext c) {
        c.state().recordProblemQuestion();
        return base(NavigationAction.EXPLORE_PROBLEM, "No problem identified yet");
    }

    private NavigationDecision.NavigationDecisionBuilder escapeToReadiness(TurnContext c) {
        boolean nothingMore = c.signals().getAnswerKind() == AnswerKind.NOTHING_MORE;
        c.state().forceTransition(Substate.READINESS_ASSESSMENT, nothingMore ? "nothing_more" : "enquiry_cycles");
        return base(NavigationAction.ASSESS_READINESS,
                nothingMore ? "Client has nothing more to add" : "Body enquiry cycles exhausted");
    }

    private NavigationDecision.NavigationDecisionBuilder reenterBodyEnquiry(TurnContext c) {
        String topic = c.signals().getNewTopics().iterator().next();
        c.state().reenterBodyEnquiry(topic);
        c.state().coverTopics(c.signals().getNewTopics());
        log.info("[{}] New topic '{}' during readiness, starting second body enquiry cycle",
                c.state().getSessionId(), topic);
        return base(NavigationAction.BODY_AWARENESS_INQUIRY, "New stressor raised during readiness")
                .payloadEntry("topic", topic);
    }

    private NavigationDecision.NavigationDecisionBuilder assessReadiness(TurnContext c) {
        SessionState state = c.state();
        if (!state.isHowDoYouKnowAsked() && !c.met(Criterion.PATTERN_UNDERSTOOD)) {
            state.markHowDoYouKnowAsked();
            return base(NavigationAction.PATTERN_INQUIRY, "Trigger pattern not yet explored");
        }
        return base(NavigationAction.ASSESS_READINESS, "Check nothing is missing before down-regulation");
    }

    private NavigationDecision.NavigationDecisionBuilder alphaPermission(TurnContext c) {
        Exchange last = c.state().lastExchange();
        boolean alreadyAsked = last != null
                && (NavigationAction.REQUEST_ALPHA_PERMISSION.getCode().equals(last.getAction())
                || NavigationAction.REASSURE_ALPHA_PERMISSION.getCode().equals(last.getAction()));
        if (alreadyAsked) {
            return base(NavigationAction.REASSURE_ALPHA_PERMISSION, "Permission not given yet");
        }
        return base(NavigationAction.REQUEST_ALPHA_PERMISSION, "Readiness confirmed, ask permission to begin");
    }

    private NavigationDecision.NavigationDecisionBuilder checkpoint(TurnContext c) {
        SessionState state = c.state();
        CheckpointSequence sequence = state.getCheckpoint();
        if (sequence == null) {
            sequence = state.startCheckpoint(settings.getCheckpointStepCount());
            return stepPayload(base(NavigationAction.CHECKPOINT_INSTRUCTION, "Begin relaxation sequence"), sequence)
                    .payloadEntry("first", true);
        }
        CheckpointOutcome outcome = sequence.advance(c.text());
        log.info("[{}] Checkpoint reply {} -> {}", state.getSessionId(), outcome.getReply(), outcome.getKind());
        switch (outcome.getKind()) {
            case ADVANCED:
                return stepPayload(base(NavigationAction.CHECKPOINT_INSTRUCTION, "Calm reply, next step"), sequence)
                        .payloadEntry("affirm", true);
            case COMPLETED:
                state.markCriterion(Criterion.READY_FOR_NEXT_STAGE, "checkpoint sequence complete");
                advance(state);
                return base(NavigationAction.SEQUENCE_COMPLETE, "All checkpoint steps answered calm")
                        .readyForNext(true)
                        .payloadEntry("downRegulated", sequence.isDownRegulated());
            case RESISTANCE:
                return stepPayload(base(NavigationAction.NORMALIZE_RESISTANCE, "Tense reply, repeat step"), sequence);
            case RETRY:
                return stepPayload(base(NavigationAction.RETRY_CHECKPOINT, "Neutral reply, give it a moment"), sequence);
            case CLARIFY:
            default:
                return stepPayload(base(NavigationAction.CLARIFY_CHECKPOINT, "Reply not understood"), sequence);
        }
    }

    private static NavigationDecision.NavigationDecisionBuilder stepPayload(
            NavigationDecision.NavigationDecisionBuilder builder, CheckpointSequence sequence) {
        return builder
                .payloadEntry("step", sequence.currentInstruction().name())
                .payloadEntry("stepIndex", sequence.getCurrentStep())
                .payloadEntry("stepCount", sequence.getStepCount());
    }

    private BodyStep pickBodyStep(TurnContext c) {
        SessionState state = c.state();
        TurnSignals signals = c.signals();
        if (state.isLocationCaptured() && state.isSensationCaptured() && !state.isWhatElseAsked()) {
            return BodyStep.WHAT_ELSE;
        }
        if (signals.isMentionsLocation() && !state.isSensationCaptured()) {
            return BodyStep.ASK_SENSATION;
        }
        if (signals.isMentionsSensation() && !state.isLocationCaptured()) {
            return BodyStep.ASK_LOCATION_FOR_SENSATION;
        }
        if (signals.isBodyDisclosure() && !c.met(Criterion.PRESENT_MOMENT_FOCUS)) {
            return BodyStep.ASK_PRESENT_MOMENT;
        }
        if (signals.getAnswerKind() == AnswerKind.EMOTION && !state.isLocationCaptured()) {
            return BodyStep.ASK_LOCATION_FOR_EMOTION;
        }
        if (signals.getAnswerKind() == AnswerKind.CONFUSION) {
            return BodyStep.CLARIFY;
        }
        return null;
    }

    private NavigationDecision.NavigationDecisionBuilder bodyEnquiry(TurnContext c) {
        BodyStep step = pickBodyStep(c);
        String text = c.text();
        switch (step) {
            case WHAT_ELSE:
                c.state().recordWhatElseAsked(settings.getBodyEnquiryCycleCap());
                return base(NavigationAction.ASK_WHAT_ELSE, "Location and sensation captured")
                        .payloadEntry("affirm", true)
                        .payloadEntry("cycle", c.state().getBodyEnquiryCycles());
            case ASK_SENSATION:
                return base(NavigationAction.BODY_SENSATION_INQUIRY, "Location given, ask about the sensation")
                        .payloadEntry("affirm", true)
                        .payloadEntry("location", SignalLexicon.firstMatch(SignalLexicon.BODY_LOCATION, text));
            case ASK_LOCATION_FOR_SENSATION:
                return base(NavigationAction.BODY_AWARENESS_INQUIRY, "Sensation given, ask where it sits")
                        .payloadEntry("affirm", true)
                        .payloadEntry("sensation", SignalLexicon.firstMatch(SignalLexicon.SENSATION, text));
            case ASK_PRESENT_MOMENT:
                return base(NavigationAction.PRESENT_MOMENT_INQUIRY, "Body detail given, anchor in the present")
                        .payloadEntry("affirm", true);
            case ASK_LOCATION_FOR_EMOTION:
                return base(NavigationAction.BODY_AWARENESS_INQUIRY, "Emotion named, find it in the body")
                        .payloadEntry("emotion", SignalLexicon.firstMatch(SignalLexicon.EMOTION, text));
            case CLARIFY:
            default:
                return base(NavigationAction.CLARIFY_CONFUSION, "Client did not follow the question");
        }
    }

    private String uncertaintyContext(TurnContext c) {
        String text = c.text();
        if (SignalLexicon.matches(FEELINGS_CONTEXT, text)) return "feelings";
        if (SignalLexicon.matches(GOAL_CONTEXT, text)) return "goal";
        if (SignalLexicon.matches(BODY_CONTEXT, text) || c.signals().isBodyDisclosure()) return "body";
        switch (c.substate()) {
            case GOAL_AND_VISION:
                return "goal";
            case PSYCHO_EDUCATION:
                return "feelings";
            case PROBLEM_AND_BODY:
                return "body";
            default:
                return "general";
        }
    }

    // ---- generative fallback ----

    private NavigationDecision generativeDecision(TurnContext c) {
        SessionState state = c.state();
        PromptContext prompt = buildPrompt(c);
        try {
            GenerativeDecision suggestion = generativeClient.generateDecision(prompt);
            NavigationAction action = validAction(suggestion);
            String rewrite = rewriteReason(c, action);
            if (rewrite != null) {
                log.info("[{}] Generative suggestion {} rewritten: {}", state.getSessionId(), action.getCode(), rewrite);
                return defaultDecision(c, "Suggestion " + action.getCode() + " rewritten: " + rewrite);
            }
            applyActionEffects(c, action);
            log.info("[{}] Generative decision -> {}", state.getSessionId(), action.getCode());
            return base(action, StringUtils.defaultIfBlank(suggestion.getReasoning(), "Generative decision"))
                    .situationType(StringUtils.defaultIfBlank(suggestion.getSituationType(), action.getSituationType()))
                    .retrievalTag(StringUtils.defaultIfBlank(suggestion.getRetrievalTag(), action.getRetrievalTag()))
                    .readyForNext(Boolean.TRUE.equals(suggestion.getReadyForNext()))
                    .appliedRule(RULE_GENERATIVE)
                    .ruleOverrideApplied(false)
                    .fallbackUsed(false)
                    .build();
        } catch (CoachException e) {
            log.warn("[{}] Generative decision unavailable, using local default: {}", state.getSessionId(), e.getMessage());
            return defaultDecision(c, "Local default after generative failure");
        }
    }

    private static NavigationAction validAction(GenerativeDecision suggestion) {
        if (suggestion == null || StringUtils.isBlank(suggestion.getDecision())) {
            throw new MalformedGenerativeResponseException("Response has no decision field");
        }
        NavigationAction action = NavigationAction.fromCode(suggestion.getDecision())
                .orElseThrow(() -> new MalformedGenerativeResponseException(
                        "Unknown decision '" + suggestion.getDecision() + "'"));
        if (!GENERATIVE_ACTIONS.contains(action)) {
            throw new MalformedGenerativeResponseException("Decision '" + action.getCode() + "' is not selectable");
        }
        return action;
    }

    /** Why a suggested action breaks the session's limits, or null when it is acceptable. */
    private String rewriteReason(TurnContext c, NavigationAction action) {
        SessionState state = c.state();
        Substate substate = state.getSubstate();
        if (action.isBodyQuestion() && substate != Substate.PROBLEM_AND_BODY) {
            return "body questions are only asked during problem and body enquiry";
        }
        if (action.isBodyQuestion() && state.getBodyQuestionsAsked() >= settings.getBodyQuestionCap()) {
            return "body question cap reached";
        }
        if (action == NavigationAction.PATTERN_INQUIRY
                && (state.isHowDoYouKnowAsked() || !substate.isAtLeast(Substate.PROBLEM_AND_BODY))) {
            return "pattern inquiry is asked once, after the problem phase starts";
        }
        if (action == NavigationAction.EXPLORE_PROBLEM
                && (substate != Substate.PROBLEM_AND_BODY
                || state.problemQuestionAskedWithin(settings.getProblemQuestionWindow()))) {
            return "problem question asked recently or out of place";
        }
        if ((action == NavigationAction.CLARIFY_GOAL || action == NavigationAction.BUILD_VISION)
                && substate != Substate.GOAL_AND_VISION) {
            return "goal work is finished";
        }
        if (action == NavigationAction.ASSESS_READINESS && substate != Substate.READINESS_ASSESSMENT) {
            return "readiness is assessed only in readiness assessment";
        }
        return null;
    }

    private NavigationDecision defaultDecision(TurnContext c, String reasoning) {
        NavigationAction action = defaultAction(c);
        applyActionEffects(c, action);
        return base(action, reasoning)
                .appliedRule(RULE_DEFAULT)
                .ruleOverrideApplied(false)
                .fallbackUsed(true)
                .build();
    }

    /** Canonical next action for the current substate. */
    private NavigationAction defaultAction(TurnContext c) {
        SessionState state = c.state();
        switch (state.getSubstate()) {
            case GOAL_AND_VISION:
                return c.met(Criterion.GOAL_STATED) ? NavigationAction.BUILD_VISION : NavigationAction.CLARIFY_GOAL;
            case PSYCHO_EDUCATION:
                return NavigationAction.PROVIDE_PSYCHO_EDUCATION;
            case PROBLEM_AND_BODY:
                if (!c.met(Criterion.PROBLEM_IDENTIFIED)
                        && !state.problemQuestionAskedWithin(settings.getProblemQuestionWindow())) {
                    return NavigationAction.EXPLORE_PROBLEM;
                }
                if (!state.isLocationCaptured()) return NavigationAction.BODY_AWARENESS_INQUIRY;
                if (!state.isSensationCaptured()) return NavigationAction.BODY_SENSATION_INQUIRY;
                return NavigationAction.PRESENT_MOMENT_INQUIRY;
            case READINESS_ASSESSMENT:
                return NavigationAction.ASSESS_READINESS;
            case ALPHA_PERMISSION:
                return NavigationAction.REQUEST_ALPHA_PERMISSION;
            case ALPHA_SEQUENCE:
                return NavigationAction.CHECKPOINT_INSTRUCTION;
            case COMPLETE:
            default:
                return NavigationAction.SESSION_CLOSED;
        }
    }

    /** State changes implied by choosing an action outside the ladder. */
    private void applyActionEffects(TurnContext c, NavigationAction action) {
        SessionState state = c.state();
        switch (action) {
            case BUILD_VISION:
                state.markCriterion(Criterion.VISION_PRESENTED, state.getCompletion().getEvidence(Criterion.GOAL_STATED));
                break;
            case PROVIDE_PSYCHO_EDUCATION:
                state.markCriterion(Criterion.PSYCHO_EDUCATION_PROVIDED, "stress response explained");
                break;
            case EXPLORE_PROBLEM:
                state.recordProblemQuestion();
                break;
            case PATTERN_INQUIRY:
                state.markHowDoYouKnowAsked();
                break;
            default:
                break;
        }
    }

    private PromptContext buildPrompt(TurnContext c) {
        SessionState state = c.state();
        Map<String, Integer> counters = new LinkedHashMap<>();
        counters.put("turn", state.currentTurn());
        counters.put("bodyQuestionsAsked", state.getBodyQuestionsAsked());
        counters.put("bodyEnquiryCycles", state.getBodyEnquiryCycles());
        counters.put("anythingElseAskedCount", state.getAnythingElseAskedCount());
        counters.put("consecutiveMinimalReplies", state.getEngagement().getConsecutiveMinimal());

        List<Exchange> history = state.getConversationHistory();
        List<String> recent = history.subList(Math.max(0, history.size() - PROMPT_EXCHANGES), history.size())
                .stream()
                .map(e -> "Client: " + e.getInput() + " | Coach: " + e.getOutput())
                .collect(Collectors.toList());

        return PromptContext.builder()
                .sessionId(state.getSessionId())
                .stage(state.getStage().name())
                .substate(state.getSubstate().getCode())
                .userText(c.text())
                .emotionalState(c.classified().getEmotionalState() != null
                        ? c.classified().getEmotionalState().getCode() : null)
                .completion(state.getCompletion().asMap())
                .counters(counters)
                .recentExchanges(recent)
                .allowedDecisions(GENERATIVE_ACTIONS.stream().map(NavigationAction::getCode).collect(Collectors.toList()))
                .build();
    }

    // ---- accounting ----

    private void countBodyQuestion(TurnContext c, NavigationDecision decision) {
        NavigationAction action = decision.getAction();
        if (!action.isBodyQuestion()) {
            return;
        }
        SessionState state = c.state();
        if (action.getBodyCategory().isSuppliedBy(c.signals().getAnswerKind())) {
            log.debug("[{}] {} not counted, client just answered that category", state.getSessionId(), action.getCode());
            return;
        }
        state.incrementBodyQuestions(settings.getBodyQuestionCap());
        log.debug("[{}] bodyQuestionsAsked={}", state.getSessionId(), state.getBodyQuestionsAsked());
    }

    private void advance(SessionState state) {
        Substate from = state.getSubstate();
        // a re-entered body enquiry cycle only ends through the escape rules
        if (from == Substate.PROBLEM_AND_BODY && state.getReentryCount() > 0) {
            return;
        }
        if (state.advanceIfComplete()) {
            log.info("[{}] Substate {} -> {}", state.getSessionId(), from.getCode(), state.getSubstate().getCode());
        }
    }

    private NavigationDecision.NavigationDecisionBuilder engagementCheck(TurnContext c) {
        EngagementAssessment engagement = c.engagement();
        c.state().getEngagement().markIntervention(c.state().currentTurn());
        return base(NavigationAction.ENGAGEMENT_CHECK, "Replies have gone " + engagement.getType().name().toLowerCase()
                + ", check in with the client")
                .payloadEntry("intervention", engagement.getIntervention())
                .payloadEntry("engagementLevel", engagement.getLevel().name().toLowerCase())
                .payloadEntry("handoffRecommended", engagement.isHandoffRecommended());
    }

    private static NavigationDecision finish(SessionState state, NavigationDecision decision) {
        List<String> missing = state.getSubstate().getRequiredToAdvance().stream()
                .filter(criterion -> !state.isMet(criterion))
                .map(Criterion::getKey)
                .collect(Collectors.toList());
        return decision.toBuilder()
                .substate(state.getSubstate())
                .clearBlockedBy()
                .blockedBy(missing)
                .readyForNext(decision.isReadyForNext() || (missing.isEmpty() && state.getSubstate() != Substate.COMPLETE))
                .build();
    }

    private static NavigationDecision.NavigationDecisionBuilder base(NavigationAction action, String reasoning) {
        return NavigationDecision.builder()
                .action(action)
                .situationType(action.getSituationType())
                .retrievalTag(action.getRetrievalTag())
                .reasoning(reasoning);
    }

    private static TurnSignals emptySignals() {
        return TurnSignals.builder()
                .answerKind(AnswerKind.GENERAL)
                .topics(Set.of())
                .newTopics(Set.of())
                .build();
    }
}
