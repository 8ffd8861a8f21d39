package com.ai.coach.engine;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Curated keyword lexicons shared by the session signal detectors.
 * All patterns are case-insensitive and word-bounded.
 */
public final class SignalLexicon {

    public static final Pattern EMOTION = Pattern.compile(
            "\\b(angry|anger|sad|sadness|hurt|anxious|anxiety|stressed|stress|worried|worry|fear|afraid|scared"
                    + "|frustrated|upset|mad|depressed|overwhelmed|lonely|nervous|guilty|ashamed|hopeless|panic|grief)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern BODY_LOCATION = Pattern.compile(
            "\\b(chest|head|shoulders?|neck|stomach|throat|belly|heart|gut|jaw|arms?|legs?|hands?|face"
                    + "|forehead|temples|ribs|everywhere|all over)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern SENSATION = Pattern.compile(
            "\\b(ache|aching|tight|tightness|heavy|heaviness|sharp|dull|pressure|tingling|burning|tense"
                    + "|tension|numb|sore|stiff|knot|knotted|fluttering|racing|pounding|clenched|hollow|pain)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern GOAL_PHRASE = Pattern.compile(
            "\\b(want to (feel|be)|would like to (feel|be)|i'd like to (feel|be)|need to feel|hope to (feel|be)"
                    + "|wanna (feel|be)|wish (i could|to) (feel|be)|i want more)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern GOAL_STATE = Pattern.compile(
            "\\b(peaceful|calm|calmer|happy|happier|better|relaxed|safe|grounded|free|lighter|at ease"
                    + "|confident|content|balanced|centered|centred|rested|in control)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern STRESSOR = Pattern.compile(
            "\\b(work|stress|stressed|pressure|deadlines?|boss|job|relationship|partner|family|money|bills|health"
                    + "|anxiety|worry|worried|overwhelm|overwhelmed|difficult|hard|problem|issue|tired|exhausted"
                    + "|conflict|argument|divorce|lonely|grief|exams?)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern PROBLEM_STATEMENT = Pattern.compile(
            "\\b(because|can't|cannot|unable to|making it hard|struggle|struggling|keeps happening)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern PROBLEM_TALK = Pattern.compile(
            "\\b(problem|issue|difficult|hard|struggle|struggling|stress|stressed|anxious|worried)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern BODY_AWARENESS = Pattern.compile(
            "\\b(feel it in|feeling it in|i notice it|in my body)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern PRESENT_MOMENT = Pattern.compile(
            "\\b(right now|now|currently|at the moment|i can feel|feeling it now|in this moment|as we speak)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern PATTERN_PHRASE = Pattern.compile(
            "\\b(when i|usually|every time|whenever|i notice|it starts when|it happens when|always when|each time)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern VISION_ACCEPT = Pattern.compile(
            "\\b(exactly|absolutely|perfect|that's right|you're right|sounds (good|right|great|nice)|that sounds"
                    + "|makes sense|what i want|definitely|i'd love that|i would love that)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern NEGATION = Pattern.compile(
            "\\b(not|don't|dont|no|nope|but|never|doesn't)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern EXPLICIT_REJECTION = Pattern.compile(
            "(^\\s*(no|nope|nah)\\b|\\bnot really\\b|\\bthat's not\\b|\\bdoesn't make sense\\b|\\bdon't want\\b)",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern IMPLICIT_ACCEPTANCE_LANGUAGE = Pattern.compile(
            "\\b(feel|feeling|chest|heavy|sad|better|body|heart|tight|lighter|breathe|breathing)\\b",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern NOTHING_MORE = Pattern.compile(
            "^\\s*(nothing( else| more)?|no|nope|nah|that's it|that's all|that is all|nothing else really"
                    + "|i'm good|all good|not really|no that's it|no that's all|no nothing else)\\s*[.!]?\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern CONFUSION = Pattern.compile(
            "\\b(what do you mean|i don't understand|confused|huh|not sure what you mean|can you explain|what\\?)",
            Pattern.CASE_INSENSITIVE
    );

    public static final Pattern READINESS = Pattern.compile(
            "\\b(i'm ready|i am ready|ready|let's do it|let's go|let's try|go ahead|let's start)\\b",
            Pattern.CASE_INSENSITIVE
    );

    private SignalLexicon() {
    }

    public static boolean matches(Pattern pattern, String text) {
        return text != null && pattern.matcher(text).find();
    }

    /** First match in lower case, or null. */
    public static String firstMatch(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group().toLowerCase() : null;
    }

    public static Set<String> allMatches(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null) {
            return found;
        }
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group().toLowerCase());
        }
        return found;
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
