package com.ai.coach.service;

import com.ai.coach.component.ConversationStore;
import com.ai.coach.conversation.SessionState;
import com.ai.coach.dto.SessionSnapshot;
import com.ai.coach.dto.SessionSummary;
import com.ai.coach.dto.TurnResponse;
import com.ai.coach.exception.InvalidTurnException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Entry point for session turns. Turns for one session run one at a time; different
 * sessions run in parallel. State is saved only after the whole turn succeeded, so a
 * failed turn leaves the stored session as it was.
 */
@Service
public class CoachingTurnService {

    private static final Logger log = LoggerFactory.getLogger(CoachingTurnService.class);

    private final SessionStateService sessionStateService;
    private final ConversationOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final ResponseComposer composer;
    private final Map<String, SessionLock> locks = new ConcurrentHashMap<>();

    public CoachingTurnService(SessionStateService sessionStateService,
                               ConversationOrchestrator orchestrator,
                               ConversationStore conversationStore,
                               ResponseComposer composer) {
        this.sessionStateService = sessionStateService;
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.composer = composer;
    }

    public SessionStarted start(String requestedId) {
        SessionState state = sessionStateService.create(requestedId);
        return new SessionStarted(SessionSnapshot.of(state), composer.opening());
    }

    public TurnResponse takeTurn(String sessionId, String userText) {
        if (StringUtils.isBlank(userText)) {
            throw new InvalidTurnException("userText must not be blank");
        }
        SessionLock lock = acquire(sessionId);
        try {
            SessionState state = sessionStateService.load(sessionId);
            ConversationOrchestrator.OrchestratorResult result = orchestrator.process(state, userText);
            sessionStateService.save(state);

            int turn = state.getTurnCount();
            String action = result.getDecision().getAction().getCode();
            conversationStore.appendUser(sessionId, turn, userText);
            conversationStore.appendAssistant(sessionId, turn, result.getReply(), action);
            log.info("[{}] Turn {} done, substate={}", sessionId, turn, state.getSubstate().getCode());

            return TurnResponse.builder()
                    .sessionId(sessionId)
                    .turn(turn)
                    .reply(result.getReply())
                    .decision(result.getDecision())
                    .examples(result.getExamples())
                    .state(SessionSnapshot.of(state))
                    .build();
        } finally {
            release(sessionId, lock);
        }
    }

    public SessionSnapshot snapshot(String sessionId) {
        return SessionSnapshot.of(sessionStateService.load(sessionId));
    }

    public List<SessionSummary> list() {
        return sessionStateService.list().stream()
                .map(r -> SessionSummary.builder()
                        .sessionId(r.getSessionId())
                        .substate(r.getSubstate())
                        .turnCount(r.getTurnCount())
                        .updatedAt(r.getUpdatedAt())
                        .build())
                .collect(Collectors.toList());
    }

    public void end(String sessionId) {
        SessionLock lock = acquire(sessionId);
        try {
            sessionStateService.delete(sessionId);
            log.info("[{}] Session ended, transcript kept in the archive", sessionId);
        } finally {
            release(sessionId, lock);
        }
    }

    /** Number of sessions that currently hold or wait for a lock. */
    int activeLocks() {
        return locks.size();
    }

    private SessionLock acquire(String sessionId) {
        SessionLock held = locks.compute(sessionId, (id, existing) -> {
            SessionLock lock = existing != null ? existing : new SessionLock();
            lock.users++;
            return lock;
        });
        held.lock.lock();
        return held;
    }

    // The entry leaves the map once nobody holds or waits for it.
    private void release(String sessionId, SessionLock held) {
        held.lock.unlock();
        locks.computeIfPresent(sessionId, (id, lock) -> --lock.users == 0 ? null : lock);
    }

    private static final class SessionLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public static final class SessionStarted {
        private final SessionSnapshot session;
        private final String opening;

        public SessionStarted(SessionSnapshot session, String opening) {
            this.session = session;
            this.opening = opening;
        }

        public SessionSnapshot getSession() {
            return session;
        }

        public String getOpening() {
            return opening;
        }
    }
}
