package com.ai.coach.service;

import com.ai.coach.component.ResponsePhrases;
import com.ai.coach.conversation.Exchange;
import com.ai.coach.conversation.QuestionText;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.EmotionalState;
import com.ai.coach.dto.NavigationAction;
import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;
import com.ai.coach.engine.AffirmationClassifier;
import com.ai.coach.engine.EngagementTracker;
import com.ai.coach.engine.EngineSettings;
import com.ai.coach.engine.GenerativeDecisionClient;
import com.ai.coach.engine.ImplicitAcceptanceHeuristic;
import com.ai.coach.engine.NavigationDecisionEngine;
import com.ai.coach.engine.SessionSignalDetector;
import com.ai.coach.exception.ClassificationUnavailableException;
import com.ai.coach.exception.GenerativeCallFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationOrchestratorTest {

    private final ResponseComposer composer = new ResponseComposer(new ResponsePhrases(), 5);

    @Nested
    @DisplayName("Degraded collaborators")
    class Fallbacks {

        @Mock
        private TextSignalClassifier classifier;
        @Mock
        private NavigationDecisionEngine engine;
        @Mock
        private ExampleRetriever retriever;

        private ConversationOrchestrator orchestrator;
        private SessionState state;

        @BeforeEach
        void setUp() {
            orchestrator = new ConversationOrchestrator(classifier, engine, retriever, composer, 3);
            state = new SessionState("orchestrator");
            lenient().when(engine.decide(anyString(), any(), any()))
                    .thenReturn(NavigationDecision.builder().action(NavigationAction.ASK_WHAT_ELSE).build());
        }

        @Test
        @DisplayName("classification failure continues with neutral input")
        void classifierDown() {
            when(classifier.classify("hello")).thenThrow(new ClassificationUnavailableException("down"));

            orchestrator.process(state, "hello");

            verify(engine).decide(eq("hello"),
                    argThat((ClassifiedInput c) -> c.getEmotionalState() == EmotionalState.NEUTRAL_UNCLEAR),
                    same(state));
        }

        @Test
        @DisplayName("an unexpected classifier error also continues with neutral input")
        void classifierThrowsUnchecked() {
            when(classifier.classify("hello")).thenThrow(new IllegalStateException("pattern table not loaded"));

            ConversationOrchestrator.OrchestratorResult result = orchestrator.process(state, "hello");

            verify(engine).decide(eq("hello"),
                    argThat((ClassifiedInput c) -> c.getEmotionalState() == EmotionalState.NEUTRAL_UNCLEAR),
                    same(state));
            assertFalse(result.getReply().isBlank());
            assertEquals(1, state.getTurnCount());
        }

        @Test
        @DisplayName("retrieval failure continues without examples")
        void retrieverDown() {
            when(classifier.classify("hello")).thenReturn(ClassifiedInput.neutral("hello"));
            when(retriever.retrieveExamples(any(), anyString(), anyInt())).thenThrow(new IllegalStateException("index gone"));

            ConversationOrchestrator.OrchestratorResult result = orchestrator.process(state, "hello");

            assertTrue(result.getExamples().isEmpty());
            assertFalse(result.getReply().isBlank());
        }

        @Test
        @DisplayName("null examples are treated as none")
        void retrieverNull() {
            when(classifier.classify("hello")).thenReturn(ClassifiedInput.neutral("hello"));
            when(retriever.retrieveExamples(any(), anyString(), anyInt())).thenReturn(null);

            assertTrue(orchestrator.process(state, "hello").getExamples().isEmpty());
        }

        @Test
        @DisplayName("the exchange is appended with the action code")
        void appendsExchange() {
            when(classifier.classify("hello")).thenReturn(ClassifiedInput.neutral("hello"));
            when(retriever.retrieveExamples(any(), anyString(), anyInt()))
                    .thenReturn(List.of(new RetrievedExample("what_else", "What else do you notice?", 1.0)));

            ConversationOrchestrator.OrchestratorResult result = orchestrator.process(state, "hello");

            assertEquals(1, state.getTurnCount());
            Exchange exchange = state.lastExchange();
            assertEquals("hello", exchange.getInput());
            assertEquals(result.getReply(), exchange.getOutput());
            assertEquals("ask_what_else", exchange.getAction());
            assertEquals(1, result.getExamples().size());
        }
    }

    @Nested
    @DisplayName("With the real engine")
    class EndToEnd {

        @Mock
        private GenerativeDecisionClient generativeClient;

        private ConversationOrchestrator orchestrator;
        private SessionState state;

        @BeforeEach
        void setUp() {
            EngineSettings settings = EngineSettings.defaults();
            NavigationDecisionEngine engine = new NavigationDecisionEngine(
                    new SessionSignalDetector(new AffirmationClassifier(), new ImplicitAcceptanceHeuristic(), settings),
                    new EngagementTracker(), generativeClient, settings);
            KeywordExampleRetriever retriever = new KeywordExampleRetriever("examples/coaching-examples.json");
            retriever.load();
            orchestrator = new ConversationOrchestrator(new LexiconTextSignalClassifier(), engine, retriever, composer, 3);
            state = new SessionState("e2e");
            lenient().when(generativeClient.generateDecision(any()))
                    .thenThrow(new GenerativeCallFailedException("offline"));
        }

        @Test
        @DisplayName("a full conversation gets a reply on every turn and never repeats itself back to back")
        void fullConversation() {
            String[] inputs = {
                    "I want to feel calm",
                    "yes, that makes sense",
                    "yes",
                    "work is really stressful",
                    "in my chest",
                    "tight",
                    "nothing else",
                    "when my boss emails me",
                    "no, that's everything",
                    "yes",
                    "calmer",
                    "more relaxed",
                    "calm"
            };
            String previous = null;
            for (String input : inputs) {
                String reply = orchestrator.process(state, input).getReply();
                assertFalse(reply.isBlank(), "empty reply for: " + input);
                assertNotEquals(previous, reply, "repeated reply for: " + input);
                previous = reply;
            }
            assertEquals(inputs.length, state.getTurnCount());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("com.ai.coach.service.ConversationOrchestratorTest#stuckConversations")
        @DisplayName("no question is repeated within five turns, even when the client keeps giving the same answer")
        void noQuestionRepeatsInsideWindow(String name, List<String> inputs) {
            for (String input : inputs) {
                Map<String, Integer> askedBefore = new HashMap<>(state.getAskedQuestions());
                int turn = state.currentTurn();
                String reply = orchestrator.process(state, input).getReply();
                assertFalse(reply.isBlank());
                for (String question : QuestionText.extractQuestions(reply)) {
                    Integer askedAt = askedBefore.get(question);
                    assertTrue(askedAt == null || turn - askedAt > 5,
                            "turn " + turn + " repeats a question from turn " + askedAt + ": " + question);
                }
            }
        }
    }

    static Stream<Arguments> stuckConversations() {
        return Stream.of(
                Arguments.of("vision offered to a hesitant client",
                        List.of("I want to feel calm", "hmm", "hmm", "hmm", "hmm", "hmm")),
                Arguments.of("client unsure every turn",
                        List.of("I don't know", "I don't know", "I don't know", "I don't know", "I don't know")),
                Arguments.of("unsure about the goal",
                        List.of("I want to feel calm", "I don't know", "not sure", "I don't know", "no idea")),
                Arguments.of("hesitant about the exercise",
                        List.of("I want to feel calm", "yes", "ok", "work stress, tight chest", "nothing else",
                                "nothing", "hmm", "maybe", "hmm", "maybe", "hmm"))
        );
    }
}
