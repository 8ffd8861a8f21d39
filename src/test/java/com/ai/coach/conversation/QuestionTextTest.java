package com.ai.coach.conversation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionTextTest {

    @Test
    @DisplayName("acknowledgements before a question are ignored")
    void stripsLeadingFillers() {
        assertEquals(List.of("what else do you notice"),
                QuestionText.extractQuestions("Okay. What else do you notice?"));
        assertEquals("what else do you notice", QuestionText.normalize("Got it, okay,  What else do   you notice?"));
    }

    @Test
    @DisplayName("every question in a reply is extracted")
    void multipleQuestions() {
        assertEquals(List.of("what haven't i understood", "is there more i should know"),
                QuestionText.extractQuestions("What haven't I understood? Is there more I should know?"));
    }

    @Test
    @DisplayName("statements yield nothing")
    void noQuestions() {
        assertTrue(QuestionText.extractQuestions("Take a breath. Notice your jaw.").isEmpty());
        assertTrue(QuestionText.extractQuestions(null).isEmpty());
    }
}
