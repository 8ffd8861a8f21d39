package com.ai.coach.service;

import com.ai.coach.conversation.SessionState;
import com.ai.coach.entity.SessionRecord;
import com.ai.coach.exception.PersistenceUnavailableException;
import com.ai.coach.exception.SessionNotFoundException;
import com.ai.coach.repository.SessionRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Whole-record storage of session state as a JSON snapshot.
 */
@Service
public class SessionStateService {

    private static final Logger log = LoggerFactory.getLogger(SessionStateService.class);

    private final SessionRecordRepository repository;
    private final ObjectMapper objectMapper;

    public SessionStateService(SessionRecordRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a fresh session. A blank id gets a generated one; an id that is already
     * stored returns the stored session unchanged.
     */
    @Transactional
    public SessionState create(String requestedId) {
        String sessionId = StringUtils.isNotBlank(requestedId) ? requestedId.trim() : UUID.randomUUID().toString();
        try {
            if (repository.existsBySessionId(sessionId)) {
                log.info("[{}] Session already exists, reusing it", sessionId);
                return load(sessionId);
            }
            SessionState state = new SessionState(sessionId);
            repository.save(SessionRecord.builder()
                    .sessionId(sessionId)
                    .substate(state.getSubstate())
                    .turnCount(0)
                    .stateJson(write(state))
                    .build());
            log.info("[{}] Session created", sessionId);
            return state;
        } catch (DataAccessException e) {
            throw persistenceFailure(sessionId, "create", e);
        }
    }

    @Transactional(readOnly = true)
    public SessionState load(String sessionId) {
        SessionRecord record;
        try {
            record = repository.findBySessionId(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
        } catch (DataAccessException e) {
            throw persistenceFailure(sessionId, "load", e);
        }
        return read(sessionId, record.getStateJson());
    }

    @Transactional
    public void save(SessionState state) {
        String sessionId = state.getSessionId();
        try {
            SessionRecord record = repository.findBySessionId(sessionId)
                    .orElseGet(() -> SessionRecord.builder().sessionId(sessionId).build());
            record.setSubstate(state.getSubstate());
            record.setTurnCount(state.getTurnCount());
            record.setStateJson(write(state));
            repository.save(record);
        } catch (DataAccessException e) {
            throw persistenceFailure(sessionId, "save", e);
        }
    }

    @Transactional(readOnly = true)
    public List<SessionRecord> list() {
        try {
            return repository.findAllByOrderByUpdatedAtDesc();
        } catch (DataAccessException e) {
            throw persistenceFailure("*", "list", e);
        }
    }

    @Transactional
    public void delete(String sessionId) {
        try {
            SessionRecord record = repository.findBySessionId(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            repository.delete(record);
            log.info("[{}] Session deleted", sessionId);
        } catch (DataAccessException e) {
            throw persistenceFailure(sessionId, "delete", e);
        }
    }

    private String write(SessionState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new PersistenceUnavailableException("Session " + state.getSessionId() + " could not be serialized", e);
        }
    }

    private SessionState read(String sessionId, String json) {
        try {
            return objectMapper.readValue(json, SessionState.class);
        } catch (JsonProcessingException e) {
            log.error("[{}] Stored session state is unreadable", sessionId, e);
            throw new PersistenceUnavailableException("Session " + sessionId + " could not be read", e);
        }
    }

    private static PersistenceUnavailableException persistenceFailure(String sessionId, String operation,
                                                                      DataAccessException e) {
        log.error("[{}] Session store {} failed", sessionId, operation, e);
        return new PersistenceUnavailableException("Session store " + operation + " failed for " + sessionId, e);
    }
}
