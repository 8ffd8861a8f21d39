package com.ai.coach.service;

import com.ai.coach.conversation.SessionState;
import com.ai.coach.dto.ClassifiedInput;
import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;
import com.ai.coach.engine.NavigationDecisionEngine;
import com.ai.coach.exception.ClassificationUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;

/**
 * One turn against an in-memory session: classify, decide, fetch examples, compose,
 * append. Never persists; the caller owns locking and storage.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final TextSignalClassifier classifier;
    private final NavigationDecisionEngine engine;
    private final ExampleRetriever retriever;
    private final ResponseComposer composer;
    private final int exampleLimit;

    public ConversationOrchestrator(TextSignalClassifier classifier,
                                    NavigationDecisionEngine engine,
                                    ExampleRetriever retriever,
                                    ResponseComposer composer,
                                    @Value("${coach.retrieval.limit:3}") int exampleLimit) {
        this.classifier = classifier;
        this.engine = engine;
        this.retriever = retriever;
        this.composer = composer;
        this.exampleLimit = exampleLimit;
    }

    public OrchestratorResult process(SessionState state, String userText) {
        ClassifiedInput classified = classify(state.getSessionId(), userText);
        NavigationDecision decision = engine.decide(userText, classified, state);
        List<RetrievedExample> examples = examples(state.getSessionId(), decision, userText);
        String reply = composer.compose(decision, state, examples);
        state.appendExchange(userText, reply, decision.getAction().getCode());
        log.debug("[{}] turn={} action={} rule={} fallback={}", state.getSessionId(), state.getTurnCount(),
                decision.getAction().getCode(), decision.getAppliedRule(), decision.isFallbackUsed());
        return new OrchestratorResult(decision, reply, examples);
    }

    private ClassifiedInput classify(String sessionId, String userText) {
        try {
            return classifier.classify(userText);
        } catch (ClassificationUnavailableException e) {
            log.warn("[{}] Classification unavailable, continuing with raw text: {}", sessionId, e.getMessage());
            return ClassifiedInput.neutral(userText);
        } catch (RuntimeException e) {
            log.warn("[{}] Classifier failed ({}), continuing with raw text: {}", sessionId,
                    e.getClass().getSimpleName(), e.getMessage());
            return ClassifiedInput.neutral(userText);
        }
    }

    private List<RetrievedExample> examples(String sessionId, NavigationDecision decision, String userText) {
        try {
            List<RetrievedExample> found = retriever.retrieveExamples(decision, userText, exampleLimit);
            return found != null ? found : Collections.emptyList();
        } catch (RuntimeException e) {
            log.warn("[{}] Example retrieval failed, continuing without examples: {}", sessionId, e.getMessage());
            return Collections.emptyList();
        }
    }

    public static final class OrchestratorResult {
        private final NavigationDecision decision;
        private final String reply;
        private final List<RetrievedExample> examples;

        public OrchestratorResult(NavigationDecision decision, String reply, List<RetrievedExample> examples) {
            this.decision = decision;
            this.reply = reply != null ? reply : "";
            this.examples = examples;
        }

        public NavigationDecision getDecision() {
            return decision;
        }

        public String getReply() {
            return reply;
        }

        public List<RetrievedExample> getExamples() {
            return examples;
        }
    }
}
