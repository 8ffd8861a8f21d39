package com.ai.coach.conversation.checkpoint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointSequenceTest {

    @Nested
    @DisplayName("Reply classification")
    class Classification {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
                "calmer, CALM",
                "a bit more relaxed, CALM",
                "less tense, CALM",
                "more tense, TENSE",
                "my jaw feels tight, TENSE",
                "not calm at all, TENSE",
                "I don't feel better, TENSE",
                "the same, NEUTRAL",
                "not sure, NEUTRAL",
                "calmer but also tense, UNRECOGNIZED",
                "purple, UNRECOGNIZED",
                "'', UNRECOGNIZED"
        })
        void classify(String reply, CheckpointReply expected) {
            assertEquals(expected, CheckpointReplyClassifier.classify(reply));
        }

        @Test
        @DisplayName("verbal confirmation is picked up but is not physiological")
        void verbalConfirmation() {
            assertEquals(Set.of(PhysiologicalIndicator.VERBAL_CONFIRMATION),
                    CheckpointReplyClassifier.indicatorsIn("calmer"));
            assertFalse(PhysiologicalIndicator.VERBAL_CONFIRMATION.isPhysiological());
            assertTrue(CheckpointReplyClassifier.indicatorsIn("I took a deep breath")
                    .contains(PhysiologicalIndicator.SLOW_DEEP_BREATH));
        }
    }

    @Nested
    @DisplayName("Advancing")
    class Advancing {

        @Test
        @DisplayName("three calm replies complete a three step sequence")
        void calmRepliesComplete() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            assertEquals(CheckpointStep.LOWER_JAW, sequence.currentInstruction());

            assertEquals(CheckpointOutcome.Kind.ADVANCED, sequence.advance("calmer").getKind());
            assertEquals(CheckpointStep.RELAX_TONGUE, sequence.currentInstruction());
            assertEquals(CheckpointOutcome.Kind.ADVANCED, sequence.advance("calm").getKind());
            assertEquals(CheckpointStep.BREATHE_SLOWER, sequence.currentInstruction());

            CheckpointOutcome last = sequence.advance("relaxed");
            assertEquals(CheckpointOutcome.Kind.COMPLETED, last.getKind());
            assertTrue(sequence.isComplete());
        }

        @Test
        @DisplayName("tense reply never advances and marks resistance")
        void tenseHoldsStep() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            CheckpointOutcome outcome = sequence.advance("more tense");

            assertEquals(CheckpointOutcome.Kind.RESISTANCE, outcome.getKind());
            assertEquals(0, sequence.getCurrentStep());
            assertEquals(CheckpointStep.LOWER_JAW, outcome.getStep());
            assertTrue(sequence.isResistanceEncountered());
            assertEquals(1, sequence.getRetries());
        }

        @Test
        @DisplayName("neutral and unclear replies retry without resistance")
        void neutralAndUnclear() {
            CheckpointSequence sequence = new CheckpointSequence(2);
            assertEquals(CheckpointOutcome.Kind.RETRY, sequence.advance("no change").getKind());
            assertEquals(CheckpointOutcome.Kind.CLARIFY, sequence.advance("banana").getKind());
            assertFalse(sequence.isResistanceEncountered());
            assertEquals(List.of(2, 0), sequence.getRepliesPerStep());
        }

        @Test
        @DisplayName("terminates after N calm replies plus R retries")
        void terminatesAfterStepsPlusRetries() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            String[] replies = {"tense", "calm", "same", "huh", "calm", "calm"};
            for (String reply : replies) {
                sequence.advance(reply);
            }
            assertTrue(sequence.isComplete());
            assertEquals(3, sequence.getRetries());
            assertThrows(IllegalStateException.class, () -> sequence.advance("calm"));
        }

        @Test
        @DisplayName("a sequence needs at least one step")
        void rejectsZeroSteps() {
            assertThrows(IllegalArgumentException.class, () -> new CheckpointSequence(0));
        }
    }

    @Nested
    @DisplayName("Down-regulation")
    class DownRegulation {

        @Test
        @DisplayName("calm words alone are not enough")
        void verbalOnly() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            sequence.advance("calmer");
            sequence.advance("calm");
            sequence.advance("better");
            assertFalse(sequence.isDownRegulated());
        }

        @Test
        @DisplayName("two calm replies with a bodily cue")
        void withBodilyCue() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            sequence.advance("calmer, I took a deep breath");
            assertFalse(sequence.isDownRegulated());
            sequence.advance("calm");
            assertTrue(sequence.isDownRegulated());
        }

        @Test
        @DisplayName("summary reports progress and copy is independent")
        void summaryAndCopy() {
            CheckpointSequence sequence = new CheckpointSequence(3);
            sequence.advance("tense");
            sequence.advance("looser now");
            CheckpointSequence copy = sequence.copy();
            sequence.advance("calm");

            Map<String, Object> summary = copy.summary();
            assertEquals(1, summary.get("stepsCompleted"));
            assertEquals(true, summary.get("resistanceEncountered"));
            assertEquals(1, summary.get("retries"));
            assertEquals(List.of(PhysiologicalIndicator.SOFTENING), summary.get("indicators"));
            assertEquals(2, sequence.getCurrentStep());
        }
    }
}
