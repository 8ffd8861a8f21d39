package com.ai.coach.service;

import com.ai.coach.conversation.SessionState;
import com.ai.coach.conversation.Substate;
import com.ai.coach.entity.SessionRecord;
import com.ai.coach.exception.PersistenceUnavailableException;
import com.ai.coach.exception.SessionNotFoundException;
import com.ai.coach.repository.SessionRecordRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionStateServiceTest {

    @Mock
    private SessionRecordRepository repository;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private SessionStateService service;

    @BeforeEach
    void setUp() {
        service = new SessionStateService(repository, objectMapper);
    }

    @Test
    @DisplayName("blank id gets a generated one and a fresh record")
    void createGeneratesId() {
        when(repository.existsBySessionId(any())).thenReturn(false);

        SessionState state = service.create("  ");

        ArgumentCaptor<SessionRecord> saved = ArgumentCaptor.forClass(SessionRecord.class);
        verify(repository).save(saved.capture());
        assertFalse(state.getSessionId().isBlank());
        assertEquals(state.getSessionId(), saved.getValue().getSessionId());
        assertEquals(Substate.GOAL_AND_VISION, saved.getValue().getSubstate());
        assertEquals(0, saved.getValue().getTurnCount());
        assertNotNull(saved.getValue().getStateJson());
    }

    @Test
    @DisplayName("an existing id is reused as stored")
    void createExisting() throws Exception {
        SessionState stored = new SessionState("known");
        stored.appendExchange("hi", "What would you like to feel?", "clarify_goal");
        when(repository.existsBySessionId("known")).thenReturn(true);
        when(repository.findBySessionId("known")).thenReturn(Optional.of(record("known", objectMapper.writeValueAsString(stored))));

        SessionState state = service.create("known");

        assertEquals(1, state.getTurnCount());
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("saved state loads back")
    void saveThenLoad() {
        SessionState state = new SessionState("round");
        state.appendExchange("I want to feel calm", "Does that make sense to you?", "build_vision");
        when(repository.findBySessionId("round")).thenReturn(Optional.empty());

        service.save(state);

        ArgumentCaptor<SessionRecord> saved = ArgumentCaptor.forClass(SessionRecord.class);
        verify(repository).save(saved.capture());
        assertEquals(1, saved.getValue().getTurnCount());

        when(repository.findBySessionId("round")).thenReturn(Optional.of(saved.getValue()));
        SessionState loaded = service.load("round");
        assertEquals(1, loaded.getTurnCount());
        assertEquals("I want to feel calm", loaded.lastExchange().getInput());
    }

    @Test
    @DisplayName("unknown ids are not found")
    void notFound() {
        when(repository.findBySessionId("nope")).thenReturn(Optional.empty());
        assertThrows(SessionNotFoundException.class, () -> service.load("nope"));
        assertThrows(SessionNotFoundException.class, () -> service.delete("nope"));
    }

    @Test
    @DisplayName("store failures and unreadable rows are persistence failures")
    void persistenceFailures() {
        when(repository.findBySessionId("down")).thenThrow(new DataAccessResourceFailureException("connection refused"));
        when(repository.findBySessionId("corrupt")).thenReturn(Optional.of(record("corrupt", "{not json")));

        assertThrows(PersistenceUnavailableException.class, () -> service.load("down"));
        assertThrows(PersistenceUnavailableException.class, () -> service.load("corrupt"));
    }

    private static SessionRecord record(String sessionId, String json) {
        return SessionRecord.builder()
                .sessionId(sessionId)
                .substate(Substate.GOAL_AND_VISION)
                .turnCount(1)
                .stateJson(json)
                .build();
    }
}
