package com.ai.coach.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateTest {

    private SessionState state;

    @BeforeEach
    void setUp() {
        state = new SessionState("s-1");
    }

    @Nested
    @DisplayName("Criteria and transitions")
    class Transitions {

        @Test
        @DisplayName("new session starts in goal and vision with rapport only")
        void initialState() {
            assertEquals(Substate.GOAL_AND_VISION, state.getSubstate());
            assertEquals(Stage.SAFETY_BUILDING, state.getStage());
            assertTrue(state.isMet(Criterion.RAPPORT_ESTABLISHED));
            assertFalse(state.isMet(Criterion.GOAL_STATED));
            assertEquals(1, state.currentTurn());
        }

        @Test
        @DisplayName("marking a criterion twice records one event and keeps the first evidence")
        void markOnce() {
            assertTrue(state.markCriterion(Criterion.GOAL_STATED, "calm"));
            assertFalse(state.markCriterion(Criterion.GOAL_STATED, "happy"));
            assertEquals("calm", state.getCompletion().getEvidence(Criterion.GOAL_STATED));
            assertEquals(1, state.getCompletionEvents().size());
            assertEquals("criterion:goalStated", state.getCompletionEvents().get(0).getEvent());
        }

        @Test
        @DisplayName("advances only once every required criterion is met")
        void advanceRequiresAll() {
            state.markCriterion(Criterion.GOAL_STATED, "calm");
            assertFalse(state.advanceIfComplete());

            state.markCriterion(Criterion.VISION_ACCEPTED, "yes");
            assertTrue(state.advanceIfComplete());
            assertEquals(Substate.PSYCHO_EDUCATION, state.getSubstate());
            assertEquals("advanced:1.1.5_psycho_education",
                    state.getCompletionEvents().get(state.getCompletionEvents().size() - 1).getEvent());
        }

        @Test
        @DisplayName("complete has no successor")
        void completeIsTerminal() {
            state.forceTransition(Substate.COMPLETE, "test");
            assertFalse(state.advanceIfComplete());
            assertNull(Substate.COMPLETE.next());
            assertEquals(Stage.CLOSED, state.getStage());
        }

        @Test
        @DisplayName("body enquiry re-entry is allowed once")
        void reentryOnce() {
            state.forceTransition(Substate.READINESS_ASSESSMENT, "test");
            state.captureLocation();
            state.reenterBodyEnquiry("money");

            assertEquals(Substate.PROBLEM_AND_BODY, state.getSubstate());
            assertFalse(state.isLocationCaptured());
            assertEquals(1, state.getReentryCount());
            assertThrows(IllegalStateException.class, () -> state.reenterBodyEnquiry("family"));
        }
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("body questions stop at the cap")
        void bodyQuestionCap() {
            for (int i = 0; i < 5; i++) {
                state.incrementBodyQuestions(3);
            }
            assertEquals(3, state.getBodyQuestionsAsked());
        }

        @Test
        @DisplayName("enquiry cycles follow what-else questions up to the cap")
        void cycleCap() {
            state.recordWhatElseAsked(2);
            state.recordWhatElseAsked(2);
            state.recordWhatElseAsked(2);
            assertEquals(3, state.getAnythingElseAskedCount());
            assertEquals(2, state.getBodyEnquiryCycles());
            assertTrue(state.isWhatElseAsked());
        }

        @Test
        @DisplayName("goal turn is recorded once")
        void goalTurnOnce() {
            state.recordGoalTurn();
            state.appendExchange("hi", "hello", "clarify_goal");
            state.recordGoalTurn();
            assertEquals(1, state.getGoalTurn());
        }
    }

    @Nested
    @DisplayName("History")
    class History {

        @Test
        @DisplayName("questions in replies are remembered by turn")
        void questionsRecorded() {
            state.appendExchange("I want to feel calm", "Got it. Does that make sense to you?", "build_vision");
            assertEquals(1, state.getTurnCount());
            assertEquals(1, state.getAskedQuestions().get("does that make sense to you"));
            assertTrue(state.askedWithin("does that make sense to you", 5));
            assertFalse(state.getAskedQuestions().containsKey("what else do you notice"));
            assertEquals(Substate.GOAL_AND_VISION, state.lastExchange().getSubstateAtTime());
        }

        @Test
        @DisplayName("restore puts back an earlier copy")
        void copyAndRestore() {
            SessionState snapshot = state.copy();
            state.markCriterion(Criterion.GOAL_STATED, "calm");
            state.incrementBodyQuestions(3);
            state.appendExchange("a", "b?", "clarify_goal");
            state.startCheckpoint(3);

            state.restore(snapshot);

            assertFalse(state.isMet(Criterion.GOAL_STATED));
            assertEquals(0, state.getBodyQuestionsAsked());
            assertEquals(0, state.getTurnCount());
            assertNull(state.getCheckpoint());
            assertTrue(state.getAskedQuestions().isEmpty());
        }

        @Test
        @DisplayName("state survives a JSON round trip")
        void jsonRoundTrip() throws Exception {
            ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
            state.markCriterion(Criterion.GOAL_STATED, "calm");
            state.appendExchange("I want to feel calm", "Does that make sense?", "build_vision");
            state.forceTransition(Substate.ALPHA_SEQUENCE, "test");
            state.startCheckpoint(3).advance("calmer, deep breath");

            SessionState read = mapper.readValue(mapper.writeValueAsString(state), SessionState.class);

            assertEquals("s-1", read.getSessionId());
            assertEquals(Substate.ALPHA_SEQUENCE, read.getSubstate());
            assertEquals("calm", read.getCompletion().getEvidence(Criterion.GOAL_STATED));
            assertEquals(1, read.getTurnCount());
            assertEquals(1, read.getCheckpoint().getCurrentStep());
            assertEquals(state.getCompletionEvents().size(), read.getCompletionEvents().size());
            assertTrue(read.askedWithin("does that make sense", 5));
        }
    }
}
