package com.ai.coach.conversation;

import com.ai.coach.conversation.checkpoint.CheckpointSequence;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Progress record of one coaching conversation.
 * <p>
 * The navigation engine is the only writer. Criteria only ever move from unmet to met,
 * history and completion events are append-only, and the substate moves forward one
 * step at a time except for the forced transitions recorded in {@link #forceTransition}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionState {

    private String sessionId;
    private Instant createdAt;
    private Substate substate = Substate.GOAL_AND_VISION;
    private int substateEnteredTurn = 1;
    private CompletionCriteria completion = new CompletionCriteria();

    private int bodyQuestionsAsked;
    private int bodyEnquiryCycles;
    private int anythingElseAskedCount;
    private boolean howDoYouKnowAsked;
    private int problemQuestionTurn = -1;
    private int goalTurn = -1;
    private int reentryCount;

    private boolean locationCaptured;
    private boolean sensationCaptured;
    private boolean whatElseAsked;

    private AnswerKind lastAnswerKind = AnswerKind.GENERAL;
    private Set<String> coveredTopics = new LinkedHashSet<>();
    private Map<String, Integer> askedQuestions = new LinkedHashMap<>();
    private List<Exchange> conversationHistory = new ArrayList<>();
    private List<CompletionEvent> completionEvents = new ArrayList<>();
    private CheckpointSequence checkpoint;
    private EngagementLog engagement = new EngagementLog();

    private SessionState() {
    }

    public SessionState(String sessionId) {
        this.sessionId = sessionId;
        this.createdAt = Instant.now();
    }

    // ---- identity and position ----

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Substate getSubstate() {
        return substate;
    }

    public Stage getStage() {
        return substate.getStage();
    }

    /** Number of completed exchanges. */
    public int getTurnCount() {
        return conversationHistory.size();
    }

    /** Number the turn being processed will get once appended. */
    public int currentTurn() {
        return conversationHistory.size() + 1;
    }

    public int turnsInSubstate() {
        return currentTurn() - substateEnteredTurn;
    }

    // ---- criteria ----

    public CompletionCriteria getCompletion() {
        return completion;
    }

    public boolean isMet(Criterion criterion) {
        return completion.isMet(criterion);
    }

    public boolean markCriterion(Criterion criterion, String evidence) {
        boolean added = completion.mark(criterion, evidence);
        if (added) {
            completionEvents.add(new CompletionEvent("criterion:" + criterion.getKey(), currentTurn()));
        }
        return added;
    }

    // ---- substate transitions ----

    /**
     * Moves to the successor substate when every required criterion is met.
     *
     * @return true when the substate changed
     */
    public boolean advanceIfComplete() {
        Substate next = substate.next();
        if (next == null || !completion.allMet(substate.getRequiredToAdvance())) {
            return false;
        }
        enter(next, "advanced:" + next.getCode());
        return true;
    }

    /**
     * Moves to the target regardless of criteria. Used for loop escapes and the single
     * body-enquiry re-entry; each call is recorded with its reason.
     */
    public void forceTransition(Substate target, String reason) {
        enter(target, "forced:" + reason + ":" + target.getCode());
    }

    private void enter(Substate target, String event) {
        substate = target;
        substateEnteredTurn = currentTurn();
        completionEvents.add(new CompletionEvent(event, currentTurn()));
    }

    // ---- counters ----

    public int getBodyQuestionsAsked() {
        return bodyQuestionsAsked;
    }

    public void incrementBodyQuestions(int cap) {
        if (bodyQuestionsAsked < cap) {
            bodyQuestionsAsked++;
        }
    }

    public int getBodyEnquiryCycles() {
        return bodyEnquiryCycles;
    }

    public int getAnythingElseAskedCount() {
        return anythingElseAskedCount;
    }

    /** Records a "what else" question; the cycle count follows it up to the cap. */
    public void recordWhatElseAsked(int cycleCap) {
        anythingElseAskedCount++;
        bodyEnquiryCycles = Math.min(anythingElseAskedCount, cycleCap);
        whatElseAsked = true;
    }

    public boolean isHowDoYouKnowAsked() {
        return howDoYouKnowAsked;
    }

    public void markHowDoYouKnowAsked() {
        howDoYouKnowAsked = true;
    }

    public int getProblemQuestionTurn() {
        return problemQuestionTurn;
    }

    public void recordProblemQuestion() {
        problemQuestionTurn = currentTurn();
    }

    public boolean problemQuestionAskedWithin(int window) {
        return problemQuestionTurn > 0 && currentTurn() - problemQuestionTurn <= window;
    }

    public int getGoalTurn() {
        return goalTurn;
    }

    public void recordGoalTurn() {
        if (goalTurn < 0) {
            goalTurn = currentTurn();
        }
    }

    public int getReentryCount() {
        return reentryCount;
    }

    // ---- body enquiry cycle ----

    public boolean isLocationCaptured() {
        return locationCaptured;
    }

    public boolean isSensationCaptured() {
        return sensationCaptured;
    }

    public boolean isWhatElseAsked() {
        return whatElseAsked;
    }

    public void captureLocation() {
        locationCaptured = true;
    }

    public void captureSensation() {
        sensationCaptured = true;
    }

    /** Clears the per-cycle flags so a fresh location/sensation round can start. */
    public void startNewBodyCycle() {
        locationCaptured = false;
        sensationCaptured = false;
        whatElseAsked = false;
    }

    /** Returns to body enquiry from readiness. Allowed once per session. */
    public void reenterBodyEnquiry(String topic) {
        if (reentryCount > 0) {
            throw new IllegalStateException("Body enquiry re-entry already used for session " + sessionId);
        }
        reentryCount++;
        startNewBodyCycle();
        forceTransition(Substate.PROBLEM_AND_BODY, "reentry[" + topic + "]");
    }

    // ---- answer tracking ----

    public AnswerKind getLastAnswerKind() {
        return lastAnswerKind;
    }

    public void setLastAnswerKind(AnswerKind lastAnswerKind) {
        this.lastAnswerKind = lastAnswerKind;
    }

    public Set<String> getCoveredTopics() {
        return Collections.unmodifiableSet(coveredTopics);
    }

    public void coverTopics(Set<String> topics) {
        coveredTopics.addAll(topics);
    }

    // ---- questions and history ----

    public boolean askedWithin(String normalizedQuestion, int window) {
        Integer turn = askedQuestions.get(normalizedQuestion);
        return turn != null && currentTurn() - turn <= window;
    }

    public Map<String, Integer> getAskedQuestions() {
        return Collections.unmodifiableMap(askedQuestions);
    }

    public void appendExchange(String input, String output, String action) {
        int turn = currentTurn();
        conversationHistory.add(new Exchange(turn, Instant.now(), input, output, substate, action));
        for (String question : QuestionText.extractQuestions(output)) {
            askedQuestions.put(question, turn);
        }
    }

    public List<Exchange> getConversationHistory() {
        return Collections.unmodifiableList(conversationHistory);
    }

    public Exchange lastExchange() {
        return conversationHistory.isEmpty() ? null : conversationHistory.get(conversationHistory.size() - 1);
    }

    /** Whether the previous coach reply carried the given action code. */
    public boolean lastActionWas(String actionCode) {
        Exchange last = lastExchange();
        return last != null && actionCode.equals(last.getAction());
    }

    /** The most recent user inputs, oldest first. */
    public List<String> recentInputs(int count) {
        List<String> inputs = new ArrayList<>();
        int from = Math.max(0, conversationHistory.size() - count);
        for (int i = from; i < conversationHistory.size(); i++) {
            inputs.add(conversationHistory.get(i).getInput());
        }
        return inputs;
    }

    public List<CompletionEvent> getCompletionEvents() {
        return Collections.unmodifiableList(completionEvents);
    }

    // ---- engagement ----

    public EngagementLog getEngagement() {
        if (engagement == null) {
            engagement = new EngagementLog();
        }
        return engagement;
    }

    // ---- checkpoint ----

    public CheckpointSequence getCheckpoint() {
        return checkpoint;
    }

    public CheckpointSequence startCheckpoint(int stepCount) {
        if (checkpoint == null) {
            checkpoint = new CheckpointSequence(stepCount);
            completionEvents.add(new CompletionEvent("checkpoint:started", currentTurn()));
        }
        return checkpoint;
    }

    // ---- snapshots ----

    public SessionState copy() {
        SessionState copy = new SessionState();
        copy.copyFrom(this);
        return copy;
    }

    /** Puts this state back to an earlier copy. */
    public void restore(SessionState snapshot) {
        copyFrom(snapshot);
    }

    private void copyFrom(SessionState other) {
        sessionId = other.sessionId;
        createdAt = other.createdAt;
        substate = other.substate;
        substateEnteredTurn = other.substateEnteredTurn;
        completion = other.completion.copy();
        bodyQuestionsAsked = other.bodyQuestionsAsked;
        bodyEnquiryCycles = other.bodyEnquiryCycles;
        anythingElseAskedCount = other.anythingElseAskedCount;
        howDoYouKnowAsked = other.howDoYouKnowAsked;
        problemQuestionTurn = other.problemQuestionTurn;
        goalTurn = other.goalTurn;
        reentryCount = other.reentryCount;
        locationCaptured = other.locationCaptured;
        sensationCaptured = other.sensationCaptured;
        whatElseAsked = other.whatElseAsked;
        lastAnswerKind = other.lastAnswerKind;
        coveredTopics = new LinkedHashSet<>(other.coveredTopics);
        askedQuestions = new LinkedHashMap<>(other.askedQuestions);
        conversationHistory = new ArrayList<>(other.conversationHistory);
        completionEvents = new ArrayList<>(other.completionEvents);
        checkpoint = other.checkpoint == null ? null : other.checkpoint.copy();
        engagement = other.engagement == null ? new EngagementLog() : other.engagement.copy();
    }
}
