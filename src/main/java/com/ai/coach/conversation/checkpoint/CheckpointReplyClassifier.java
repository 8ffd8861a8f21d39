package com.ai.coach.conversation.checkpoint;

import org.apache.commons.lang3.StringUtils;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies checkpoint replies and picks out physiological down-regulation cues.
 */
public final class CheckpointReplyClassifier {

    private static final Pattern NEGATED_CALM = Pattern.compile(
            "\\b(not|isn't|don't|doesn't|no|never)\\b[\\w\\s']{0,12}\\b(calm|calmer|relaxed|better|good|lighter)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LESS_TENSE = Pattern.compile(
            "\\bless\\s+(tense|tension|tight|anxious|stressed)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern TENSE = Pattern.compile(
            "\\b(tense|tenser|tension|tight|tighter|worse|uncomfortable|weird|anxious|stressed|panicky|on edge)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern CALM = Pattern.compile(
            "\\b(calm|calmer|relaxed|relaxing|better|good|lighter|softer|peaceful|easier|loose|looser|settled)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern NEUTRAL = Pattern.compile(
            "\\b(same|no change|nothing changed|neutral|don't know|dont know|not sure|unsure|maybe|no difference)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern DEEP_BREATH = Pattern.compile(
            "\\b(deep breath|breathing deep(er|ly)?|took a breath|breathing slower|slower breath)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern EXHALE = Pattern.compile(
            "\\b(exhale|exhaling|breathe out|breathing out|sigh|sighed)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SOFTENING = Pattern.compile(
            "\\b(soft|softer|softening|relax(ed|ing)?|loose|looser|lighter|warm|jaw dropped|melting)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern VERBAL = Pattern.compile(
            "\\b(calm|calmer|peaceful|relaxed|better)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private CheckpointReplyClassifier() {
    }

    public static CheckpointReply classify(String reply) {
        if (StringUtils.isBlank(reply)) {
            return CheckpointReply.UNRECOGNIZED;
        }
        String text = reply.trim().toLowerCase();
        if (NEGATED_CALM.matcher(text).find()) {
            return CheckpointReply.TENSE;
        }
        String withoutRelief = LESS_TENSE.matcher(text).replaceAll("calmer");
        boolean tense = TENSE.matcher(withoutRelief).find();
        boolean calm = CALM.matcher(withoutRelief).find();
        if (tense && calm) {
            return CheckpointReply.UNRECOGNIZED;
        }
        if (tense) {
            return CheckpointReply.TENSE;
        }
        if (calm) {
            return CheckpointReply.CALM;
        }
        if (NEUTRAL.matcher(text).find()) {
            return CheckpointReply.NEUTRAL;
        }
        return CheckpointReply.UNRECOGNIZED;
    }

    public static Set<PhysiologicalIndicator> indicatorsIn(String reply) {
        Set<PhysiologicalIndicator> found = EnumSet.noneOf(PhysiologicalIndicator.class);
        if (StringUtils.isBlank(reply)) {
            return found;
        }
        String text = reply.toLowerCase();
        if (DEEP_BREATH.matcher(text).find()) found.add(PhysiologicalIndicator.SLOW_DEEP_BREATH);
        if (EXHALE.matcher(text).find()) found.add(PhysiologicalIndicator.LONGER_EXHALE);
        if (SOFTENING.matcher(text).find()) found.add(PhysiologicalIndicator.SOFTENING);
        if (VERBAL.matcher(text).find()) found.add(PhysiologicalIndicator.VERBAL_CONFIRMATION);
        return found;
    }
}
