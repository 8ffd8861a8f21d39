package com.ai.coach.conversation;

/**
 * Named completion criteria tracked per session. Once met, a criterion stays met.
 */
public enum Criterion {
    GOAL_STATED("goalStated"),
    VISION_PRESENTED("visionPresented"),
    VISION_ACCEPTED("visionAccepted"),
    PSYCHO_EDUCATION_PROVIDED("psychoEducationProvided"),
    PROBLEM_IDENTIFIED("problemIdentified"),
    EMOTION_IDENTIFIED("emotionIdentified"),
    BODY_AWARENESS_PRESENT("bodyAwarenessPresent"),
    PRESENT_MOMENT_FOCUS("presentMomentFocus"),
    PATTERN_UNDERSTOOD("patternUnderstood"),
    RAPPORT_ESTABLISHED("rapportEstablished"),
    READINESS_CONFIRMED("readinessConfirmed"),
    ALPHA_PERMISSION_GRANTED("alphaPermissionGranted"),
    READY_FOR_NEXT_STAGE("readyForNextStage");

    private final String key;

    Criterion(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
