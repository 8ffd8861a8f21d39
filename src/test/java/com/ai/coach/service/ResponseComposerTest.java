package com.ai.coach.service;

import com.ai.coach.component.ResponsePhrases;
import com.ai.coach.conversation.QuestionText;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.dto.NavigationAction;
import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseComposerTest {

    private final ResponsePhrases phrases = new ResponsePhrases();
    private ResponseComposer composer;
    private SessionState state;

    @BeforeEach
    void setUp() {
        composer = new ResponseComposer(phrases, 5);
        state = new SessionState("composer");
    }

    private static NavigationDecision decision(NavigationAction action) {
        return NavigationDecision.builder().action(action).build();
    }

    @Nested
    @DisplayName("Variant selection")
    class Variants {

        @Test
        @DisplayName("skips variants asked within the repeat window")
        void skipsRecentlyAsked() {
            List<String> pool = phrases.whatElse();
            state.appendExchange("a", pool.get(0), "ask_what_else");
            state.appendExchange("b", pool.get(1), "ask_what_else");

            assertEquals(pool.get(2), composer.compose(decision(NavigationAction.ASK_WHAT_ELSE), state, List.of()));
        }

        @Test
        @DisplayName("falls back to a statement without a question when every variant is recent")
        void holdingStatementWhenAllRecent() {
            List<String> pool = phrases.whatElse();
            state.appendExchange("a", pool.get(0), "ask_what_else");
            state.appendExchange("b", pool.get(1), "ask_what_else");
            state.appendExchange("c", pool.get(2), "ask_what_else");

            String reply = composer.compose(decision(NavigationAction.ASK_WHAT_ELSE), state, List.of());

            assertTrue(QuestionText.extractQuestions(reply).isEmpty(), reply);
            assertTrue(phrases.holdingStatements().stream().anyMatch(reply::endsWith), reply);
        }

        @Test
        @DisplayName("a repeated vision offer never reuses its question inside the window")
        void repeatedVisionVaries() {
            NavigationDecision repeat = NavigationDecision.builder()
                    .action(NavigationAction.BUILD_VISION)
                    .payloadEntry("goal", "calm")
                    .payloadEntry("repeat", true)
                    .build();
            for (int i = 0; i < 6; i++) {
                String reply = composer.compose(repeat, state, List.of());
                for (String q : QuestionText.extractQuestions(reply)) {
                    assertFalse(state.askedWithin(q, 5), "repeated: " + q);
                }
                state.appendExchange("hmm", reply, "build_vision");
            }
        }

        @Test
        @DisplayName("outcome menus vary when the client stays unsure")
        void outcomeMenuVaries() {
            NavigationDecision menu = NavigationDecision.builder()
                    .action(NavigationAction.OFFER_OUTCOME_MENU)
                    .payloadEntry("context", "goal")
                    .build();
            for (int i = 0; i < 6; i++) {
                String reply = composer.compose(menu, state, List.of());
                for (String q : QuestionText.extractQuestions(reply)) {
                    assertFalse(state.askedWithin(q, 5), "repeated: " + q);
                }
                state.appendExchange("I don't know", reply, "offer_outcome_menu");
            }
        }

        @Test
        @DisplayName("no verbatim question repeats across consecutive checkpoint prompts")
        void checkpointQuestionsVary() {
            NavigationDecision retry = decision(NavigationAction.RETRY_CHECKPOINT);
            for (int i = 0; i < 5; i++) {
                String reply = composer.compose(retry, state, List.of());
                for (String q : QuestionText.extractQuestions(reply)) {
                    assertFalse(state.askedWithin(q, 5), "repeated: " + q);
                }
                state.appendExchange("same", reply, "retry_checkpoint");
            }
        }
    }

    @Nested
    @DisplayName("Wording")
    class Wording {

        @Test
        @DisplayName("safety escalation asks no question")
        void safetyHasNoQuestion() {
            String reply = composer.compose(decision(NavigationAction.SAFETY_ESCALATION), state, List.of());
            assertFalse(reply.contains("?"));
        }

        @Test
        @DisplayName("vision uses the stated goal")
        void visionUsesGoal() {
            NavigationDecision d = NavigationDecision.builder()
                    .action(NavigationAction.BUILD_VISION)
                    .payloadEntry("goal", "peaceful")
                    .payloadEntry("repeat", false)
                    .build();
            assertTrue(composer.compose(d, state, List.of()).contains("peaceful"));
        }

        @Test
        @DisplayName("first checkpoint instruction opens the sequence and asks the checkpoint question")
        void firstInstruction() {
            NavigationDecision d = NavigationDecision.builder()
                    .action(NavigationAction.CHECKPOINT_INSTRUCTION)
                    .payloadEntry("first", true)
                    .payloadEntry("step", "LOWER_JAW")
                    .build();
            String reply = composer.compose(d, state, List.of());
            assertTrue(reply.startsWith("Great, let's begin."));
            assertTrue(reply.contains("jaw"));
            assertTrue(reply.endsWith("?"));
        }

        @Test
        @DisplayName("location question names the emotion")
        void locationCue() {
            NavigationDecision d = NavigationDecision.builder()
                    .action(NavigationAction.BODY_AWARENESS_INQUIRY)
                    .payloadEntry("emotion", "sad")
                    .build();
            assertTrue(composer.compose(d, state, List.of()).contains("sad"));
        }

        @Test
        @DisplayName("general inquiry prefers a retrieved example")
        void generalInquiryUsesExample() {
            RetrievedExample example = new RetrievedExample("general_inquiry", "What matters most about that today?", 2.0);
            assertEquals(example.getText(),
                    composer.compose(decision(NavigationAction.GENERAL_INQUIRY), state, List.of(example)));
        }

        @Test
        @DisplayName("engagement check leads with a hand-off suggestion when one is recommended")
        void engagementHandoff() {
            NavigationDecision d = NavigationDecision.builder()
                    .action(NavigationAction.ENGAGEMENT_CHECK)
                    .payloadEntry("intervention", "disengagement_check")
                    .payloadEntry("handoffRecommended", true)
                    .build();
            String reply = composer.compose(d, state, List.of());
            assertTrue(reply.startsWith(phrases.handoffSuggestion()));
            assertTrue(reply.endsWith("?"));
        }

        @Test
        @DisplayName("every action has wording")
        void everyActionComposes() {
            for (NavigationAction action : NavigationAction.values()) {
                assertFalse(composer.compose(decision(action), state, List.of()).isBlank(), action.getCode());
            }
        }
    }
}
