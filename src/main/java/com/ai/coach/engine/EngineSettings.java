package com.ai.coach.engine;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Limits and switches that shape the navigation policy.
 */
@Component
public class EngineSettings {

    private final int bodyQuestionCap;
    private final int bodyEnquiryCycleCap;
    private final int problemQuestionWindow;
    private final boolean implicitAcceptanceEnabled;
    private final int checkpointStepCount;

    public EngineSettings(@Value("${coach.engine.body-question-cap:3}") int bodyQuestionCap,
                          @Value("${coach.engine.body-enquiry-cycle-cap:2}") int bodyEnquiryCycleCap,
                          @Value("${coach.engine.problem-question-window:6}") int problemQuestionWindow,
                          @Value("${coach.engine.implicit-acceptance-enabled:true}") boolean implicitAcceptanceEnabled,
                          @Value("${coach.checkpoint.step-count:3}") int checkpointStepCount) {
        this.bodyQuestionCap = bodyQuestionCap;
        this.bodyEnquiryCycleCap = bodyEnquiryCycleCap;
        this.problemQuestionWindow = problemQuestionWindow;
        this.implicitAcceptanceEnabled = implicitAcceptanceEnabled;
        this.checkpointStepCount = checkpointStepCount;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(3, 2, 6, true, 3);
    }

    public int getBodyQuestionCap() {
        return bodyQuestionCap;
    }

    public int getBodyEnquiryCycleCap() {
        return bodyEnquiryCycleCap;
    }

    public int getProblemQuestionWindow() {
        return problemQuestionWindow;
    }

    public boolean isImplicitAcceptanceEnabled() {
        return implicitAcceptanceEnabled;
    }

    public int getCheckpointStepCount() {
        return checkpointStepCount;
    }
}
