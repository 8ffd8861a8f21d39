package com.ai.coach.service;

import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.EmotionalState;
import com.ai.coach.dto.InputCategory;
import com.ai.coach.dto.SafetyFlags;
import com.ai.coach.engine.SignalLexicon;
import com.ai.coach.exception.ClassificationUnavailableException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword based classifier: cleans up the text, then tags emotional state,
 * input category and the four safety flags.
 */
@Service
public class LexiconTextSignalClassifier implements TextSignalClassifier {

    private static final int UNCERTAIN_MAX_WORDS = 8;

    private static final Map<String, String> CORRECTIONS = new LinkedHashMap<>();

    static {
        CORRECTIONS.put("dont", "don't");
        CORRECTIONS.put("im", "i'm");
        CORRECTIONS.put("cant", "can't");
        CORRECTIONS.put("thats", "that's");
        CORRECTIONS.put("ive", "i've");
        CORRECTIONS.put("anxous", "anxious");
        CORRECTIONS.put("anxios", "anxious");
        CORRECTIONS.put("stresed", "stressed");
        CORRECTIONS.put("stressd", "stressed");
        CORRECTIONS.put("overwelmed", "overwhelmed");
        CORRECTIONS.put("overwhelmd", "overwhelmed");
        CORRECTIONS.put("stomache", "stomach");
        CORRECTIONS.put("sholders", "shoulders");
        CORRECTIONS.put("realy", "really");
        CORRECTIONS.put("feal", "feel");
        CORRECTIONS.put("calme", "calm");
    }

    private static final Pattern WORD = Pattern.compile("[A-Za-z']+");

    private static final Pattern CRISIS = Pattern.compile(
            "\\b(kill myself|hurt myself|harm myself|end it all|end my life|want to die|suicide|suicidal"
                    + "|better off dead|self[- ]harm|don't want to live|no reason to live|take my own life)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern THINKING = Pattern.compile(
            "\\b(i think|i believe|in my opinion|i thought|thinking about|i suppose|logically|i figured|i reckon)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PAST = Pattern.compile(
            "\\b(back then|when i was|years ago|in the past|used to|previously|as a child|growing up|last year)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PRESENT_ANCHOR = Pattern.compile(
            "\\b(now|right now|currently|today|these days|at the moment)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern UNCERTAIN = Pattern.compile(
            "\\b(i don't know|idk|not sure|no idea|dunno|i'm unsure|can't say|don't really know)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern HIGH_DISTRESS = Pattern.compile(
            "\\b(overwhelmed|panic|panicking|terrified|desperate|devastated|hopeless|furious|can't cope|falling apart)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern MILD_DISTRESS = Pattern.compile(
            "\\b(sad|anxious|stressed|worried|upset|frustrated|tense|tired|hurt|angry|nervous|down|low|lonely)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern POSITIVE = Pattern.compile(
            "\\b(calm|happy|good|better|relaxed|peaceful|great|lighter|fine)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern GREETING = Pattern.compile(
            "^\\s*(hi|hello|hey|good (morning|afternoon|evening))\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern QUESTION_START = Pattern.compile(
            "^\\s*(what|how|why|when|where|who|can|could|is|are|do|does|will|should)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern AFFIRMATION = Pattern.compile(
            "^\\s*(yes|yeah|yep|yup|sure|ok|okay|right|exactly|absolutely)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern FEELING = Pattern.compile("\\b(feel|feeling|felt)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public ClassifiedInput classify(String rawText) {
        if (rawText == null) {
            throw new ClassificationUnavailableException("No text to classify");
        }
        String corrected = correct(rawText);
        String lower = corrected.toLowerCase();
        int words = SignalLexicon.wordCount(lower);

        boolean crisis = CRISIS.matcher(lower).find();
        boolean past = PAST.matcher(lower).find() && !PRESENT_ANCHOR.matcher(lower).find();
        // "i think it's in my chest" is a body answer, not analysis
        boolean bodyAnswer = SignalLexicon.matches(SignalLexicon.BODY_LOCATION, lower)
                || SignalLexicon.matches(SignalLexicon.SENSATION, lower);
        SafetyFlags flags = SafetyFlags.builder()
                .crisis(crisis)
                .thinkingMode(!bodyAnswer && THINKING.matcher(lower).find())
                .pastTense(past)
                .uncertain(words <= UNCERTAIN_MAX_WORDS && UNCERTAIN.matcher(lower).find())
                .build();

        return ClassifiedInput.builder()
                .correctedText(corrected)
                .emotionalState(emotionalState(lower, crisis))
                .inputCategory(category(lower, words))
                .safetyFlags(flags)
                .build();
    }

    /**
     * Normalizes quotes and whitespace and fixes a small set of common misspellings.
     */
    static String correct(String rawText) {
        String text = StringUtils.normalizeSpace(rawText
                .replace('’', '\'')
                .replace('‘', '\'')
                .replace('“', '"')
                .replace('”', '"'));
        Matcher m = WORD.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String word = m.group();
            String fix = CORRECTIONS.get(word.toLowerCase());
            m.appendReplacement(out, Matcher.quoteReplacement(fix != null ? fix : word));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static EmotionalState emotionalState(String lower, boolean crisis) {
        if (crisis) return EmotionalState.CRISIS_LEVEL;
        if (HIGH_DISTRESS.matcher(lower).find()) return EmotionalState.MODERATE_DISTRESS;
        if (MILD_DISTRESS.matcher(lower).find()) return EmotionalState.MILD_DISTRESS;
        if (POSITIVE.matcher(lower).find()) return EmotionalState.POSITIVE_STATE;
        return EmotionalState.NEUTRAL_UNCLEAR;
    }

    private static InputCategory category(String lower, int words) {
        if (lower.trim().endsWith("?") || QUESTION_START.matcher(lower).find()) return InputCategory.QUESTION;
        if (GREETING.matcher(lower).find() && words <= 4) return InputCategory.GREETING;
        if (SignalLexicon.matches(SignalLexicon.GOAL_PHRASE, lower)) return InputCategory.GOAL_STATEMENT;
        if (SignalLexicon.matches(SignalLexicon.STRESSOR, lower)
                || SignalLexicon.matches(SignalLexicon.PROBLEM_STATEMENT, lower)) {
            return InputCategory.PROBLEM_DESCRIPTION;
        }
        if (FEELING.matcher(lower).find() || SignalLexicon.matches(SignalLexicon.EMOTION, lower)) {
            return InputCategory.FEELING_STATEMENT;
        }
        if (AFFIRMATION.matcher(lower).find() && words <= 5) return InputCategory.AFFIRMATION;
        return InputCategory.GENERAL_STATEMENT;
    }
}
