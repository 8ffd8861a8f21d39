package com.ai.coach.service;

import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.EmotionalState;
import com.ai.coach.dto.InputCategory;
import com.ai.coach.exception.ClassificationUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexiconTextSignalClassifierTest {

    private final LexiconTextSignalClassifier classifier = new LexiconTextSignalClassifier();

    @Nested
    @DisplayName("Safety flags")
    class Flags {

        @Test
        @DisplayName("crisis language")
        void crisis() {
            ClassifiedInput input = classifier.classify("sometimes I want to die");
            assertTrue(input.getSafetyFlags().isCrisis());
            assertEquals(EmotionalState.CRISIS_LEVEL, input.getEmotionalState());
        }

        @Test
        @DisplayName("past tense is dropped when the client anchors in the present")
        void pastWithPresentAnchor() {
            assertTrue(classifier.classify("I used to panic at school").getSafetyFlags().isPastTense());
            assertFalse(classifier.classify("I used to panic and I still do right now").getSafetyFlags().isPastTense());
        }

        @Test
        @DisplayName("thinking phrase around a body answer is not analysis")
        void thinkingWithBodyAnswer() {
            assertTrue(classifier.classify("I think it is my upbringing").getSafetyFlags().isThinkingMode());
            assertFalse(classifier.classify("I think it's in my chest").getSafetyFlags().isThinkingMode());
        }

        @Test
        @DisplayName("uncertainty only in short replies")
        void uncertainShortOnly() {
            assertTrue(classifier.classify("not sure").getSafetyFlags().isUncertain());
            assertFalse(classifier.classify("I'm not sure why but my chest gets tight whenever my boss calls")
                    .getSafetyFlags().isUncertain());
        }
    }

    @Nested
    @DisplayName("Text and categories")
    class Categories {

        @Test
        @DisplayName("common misspellings are corrected")
        void corrections() {
            assertEquals("i'm really anxious", classifier.classify("im realy anxous").getCorrectedText());
            assertEquals("It's 'fine'", LexiconTextSignalClassifier.correct("It’s   ‘fine’"));
        }

        @Test
        @DisplayName("categories")
        void categories() {
            assertEquals(InputCategory.GOAL_STATEMENT, classifier.classify("I'd like to feel calmer").getInputCategory());
            assertEquals(InputCategory.PROBLEM_DESCRIPTION, classifier.classify("Work is a lot").getInputCategory());
            assertEquals(InputCategory.QUESTION, classifier.classify("what do you mean?").getInputCategory());
            assertEquals(InputCategory.AFFIRMATION, classifier.classify("yeah").getInputCategory());
            assertEquals(InputCategory.GREETING, classifier.classify("hello there").getInputCategory());
        }

        @Test
        @DisplayName("distress levels")
        void emotionalStates() {
            assertEquals(EmotionalState.MODERATE_DISTRESS, classifier.classify("I'm overwhelmed").getEmotionalState());
            assertEquals(EmotionalState.MILD_DISTRESS, classifier.classify("a bit sad").getEmotionalState());
            assertEquals(EmotionalState.POSITIVE_STATE, classifier.classify("feeling good").getEmotionalState());
            assertEquals(EmotionalState.NEUTRAL_UNCLEAR, classifier.classify("hmm").getEmotionalState());
        }

        @Test
        @DisplayName("null text is unclassifiable")
        void nullText() {
            assertThrows(ClassificationUnavailableException.class, () -> classifier.classify(null));
        }
    }
}
