package com.ai.coach.conversation;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts and normalizes question sentences from assistant replies so that
 * repeats can be detected regardless of leading acknowledgements.
 */
public final class QuestionText {

    private static final Pattern LEADING_FILLER = Pattern.compile(
            "^(that's right|yeah|got it|okay|ok|i hear you|i see|mm)[.,!]?\\s*",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!]\\s+");

    private QuestionText() {
    }

    /**
     * Every sentence in the text that ends in a question mark, normalized.
     */
    public static List<String> extractQuestions(String text) {
        List<String> questions = new ArrayList<>();
        if (StringUtils.isBlank(text) || !text.contains("?")) {
            return questions;
        }
        String[] chunks = text.split("\\?");
        int limit = text.trim().endsWith("?") ? chunks.length : chunks.length - 1;
        for (int i = 0; i < limit; i++) {
            String[] sentences = SENTENCE_BREAK.split(chunks[i].trim());
            String last = sentences[sentences.length - 1];
            String normalized = normalize(last);
            if (!normalized.isEmpty()) {
                questions.add(normalized);
            }
        }
        return questions;
    }

    public static String normalize(String question) {
        if (question == null) {
            return "";
        }
        String s = question.trim().toLowerCase();
        String previous;
        do {
            previous = s;
            s = LEADING_FILLER.matcher(s).replaceFirst("").trim();
        } while (!s.equals(previous));
        s = StringUtils.removeEnd(s, "?").trim();
        return StringUtils.normalizeSpace(s);
    }
}
