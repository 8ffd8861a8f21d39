package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running engagement counters for one session. Only the last few levels are kept.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class EngagementLog {

    public static final int LEVEL_WINDOW = 10;

    private int consecutiveMinimal;
    private int consecutiveNonResponses;
    private int confusionCount;
    /** Turn of the last engagement check, 0 when none was made. */
    private int lastInterventionTurn;
    private List<EngagementLevel> recentLevels = new ArrayList<>();

    public void record(EngagementType type) {
        consecutiveMinimal = type.isMinimal() ? consecutiveMinimal + 1 : 0;
        consecutiveNonResponses = type.isNonResponse() ? consecutiveNonResponses + 1 : 0;
        if (type == EngagementType.CONFUSED) {
            confusionCount++;
        }
        recentLevels.add(type.getLevel());
        if (recentLevels.size() > LEVEL_WINDOW) {
            recentLevels.remove(0);
        }
    }

    public void markIntervention(int turn) {
        lastInterventionTurn = turn;
    }

    public int turnsSinceIntervention(int currentTurn) {
        return currentTurn - lastInterventionTurn;
    }

    public long lowLevelCount() {
        return recentLevels.stream().filter(EngagementLevel::isLowOrWorse).count();
    }

    public int getConsecutiveMinimal() {
        return consecutiveMinimal;
    }

    public int getConsecutiveNonResponses() {
        return consecutiveNonResponses;
    }

    public int getConfusionCount() {
        return confusionCount;
    }

    public int getLastInterventionTurn() {
        return lastInterventionTurn;
    }

    public List<EngagementLevel> getRecentLevels() {
        return Collections.unmodifiableList(recentLevels);
    }

    public EngagementLog copy() {
        EngagementLog copy = new EngagementLog();
        copy.consecutiveMinimal = consecutiveMinimal;
        copy.consecutiveNonResponses = consecutiveNonResponses;
        copy.confusionCount = confusionCount;
        copy.lastInterventionTurn = lastInterventionTurn;
        copy.recentLevels = new ArrayList<>(recentLevels);
        return copy;
    }
}
