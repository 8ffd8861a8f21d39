package com.ai.coach.engine;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AffirmationClassifierTest {

    private final AffirmationClassifier classifier = new AffirmationClassifier();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "yes|YES",
            "Okay.|YES",
            "uh huh|YES",
            "sure, go ahead|YES",
            "nope|NO",
            "not yet|NO",
            "I'd rather not|NO",
            "yes but no|UNKNOWN",
            "I'm not sure about this|UNKNOWN",
            "the weather is nice|UNKNOWN"
    })
    void classifies(String input, Affirmation expected) {
        assertEquals(expected, classifier.classify(input));
    }

    @Test
    @DisplayName("blank input is unknown")
    void blank() {
        assertEquals(Affirmation.UNKNOWN, classifier.classify(null));
        assertEquals(Affirmation.UNKNOWN, classifier.classify("   "));
        assertFalse(classifier.isAffirmative(""));
        assertFalse(classifier.isNegative(""));
    }
}
