package com.ai.coach.conversation.checkpoint;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Guided relaxation sub-sequence. Each step is an instruction followed by a
 * "more tense or more calm?" checkpoint; only a calm reply moves to the next step.
 * <p>
 * The sequence is owned by the session state and knows nothing about the outer
 * conversation: the caller feeds it replies through {@link #advance(String)} and
 * reacts to the returned {@link CheckpointOutcome}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class CheckpointSequence {

    private int stepCount;
    private int currentStep;
    private List<Integer> repliesPerStep = new ArrayList<>();
    private int calmReplies;
    private int retries;
    private boolean resistanceEncountered;
    private boolean complete;
    private EnumSet<PhysiologicalIndicator> indicators = EnumSet.noneOf(PhysiologicalIndicator.class);

    private CheckpointSequence() {
    }

    public CheckpointSequence(int stepCount) {
        if (stepCount < 1) {
            throw new IllegalArgumentException("Checkpoint sequence needs at least one step, got " + stepCount);
        }
        this.stepCount = stepCount;
        for (int i = 0; i < stepCount; i++) {
            repliesPerStep.add(0);
        }
    }

    public CheckpointOutcome advance(String reply) {
        if (complete) {
            throw new IllegalStateException("Checkpoint sequence already complete");
        }
        CheckpointReply classified = CheckpointReplyClassifier.classify(reply);
        repliesPerStep.set(currentStep, repliesPerStep.get(currentStep) + 1);

        switch (classified) {
            case CALM:
                calmReplies++;
                indicators.addAll(CheckpointReplyClassifier.indicatorsIn(reply));
                currentStep++;
                if (currentStep >= stepCount) {
                    complete = true;
                    return new CheckpointOutcome(CheckpointOutcome.Kind.COMPLETED, classified, stepCount - 1,
                            stepAt(stepCount - 1));
                }
                return outcome(CheckpointOutcome.Kind.ADVANCED, classified);
            case TENSE:
                resistanceEncountered = true;
                retries++;
                return outcome(CheckpointOutcome.Kind.RESISTANCE, classified);
            case NEUTRAL:
                retries++;
                return outcome(CheckpointOutcome.Kind.RETRY, classified);
            case UNRECOGNIZED:
            default:
                retries++;
                return outcome(CheckpointOutcome.Kind.CLARIFY, classified);
        }
    }

    private CheckpointOutcome outcome(CheckpointOutcome.Kind kind, CheckpointReply reply) {
        return new CheckpointOutcome(kind, reply, currentStep, currentInstruction());
    }

    private static CheckpointStep stepAt(int index) {
        CheckpointStep[] steps = CheckpointStep.values();
        return steps[index % steps.length];
    }

    public CheckpointStep currentInstruction() {
        return stepAt(Math.min(currentStep, stepCount - 1));
    }

    /**
     * True only when at least two replies were calm and at least one bodily cue was seen.
     */
    public boolean isDownRegulated() {
        boolean bodilyCue = indicators.stream().anyMatch(PhysiologicalIndicator::isPhysiological);
        return calmReplies >= 2 && bodilyCue;
    }

    public boolean isComplete() {
        return complete;
    }

    public boolean isResistanceEncountered() {
        return resistanceEncountered;
    }

    public int getCurrentStep() {
        return currentStep;
    }

    public int getStepCount() {
        return stepCount;
    }

    public int getRetries() {
        return retries;
    }

    public int getCalmReplies() {
        return calmReplies;
    }

    public List<Integer> getRepliesPerStep() {
        return Collections.unmodifiableList(repliesPerStep);
    }

    public EnumSet<PhysiologicalIndicator> getIndicators() {
        return EnumSet.copyOf(indicators);
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("stepsCompleted", Math.min(currentStep, stepCount));
        summary.put("stepCount", stepCount);
        summary.put("repliesPerStep", new ArrayList<>(repliesPerStep));
        summary.put("indicators", new ArrayList<>(indicators));
        summary.put("resistanceEncountered", resistanceEncountered);
        summary.put("retries", retries);
        summary.put("downRegulated", isDownRegulated());
        summary.put("complete", complete);
        return summary;
    }

    public CheckpointSequence copy() {
        CheckpointSequence copy = new CheckpointSequence();
        copy.stepCount = stepCount;
        copy.currentStep = currentStep;
        copy.repliesPerStep = new ArrayList<>(repliesPerStep);
        copy.calmReplies = calmReplies;
        copy.retries = retries;
        copy.resistanceEncountered = resistanceEncountered;
        copy.complete = complete;
        copy.indicators = EnumSet.copyOf(indicators);
        return copy;
    }
}
