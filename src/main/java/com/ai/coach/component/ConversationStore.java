package com.ai.coach.component;

import com.ai.coach.entity.ConversationMessage;
import com.ai.coach.repository.ConversationMessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Transcript archive. Messages are a read-only copy of the session history; losing
 * one never affects navigation.
 */
@Component
public class ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);
    private final ConversationMessageRepository repository;

    public ConversationStore(ConversationMessageRepository repository) {
        this.repository = repository;
    }

    public List<ConversationMessage> getHistory(String sessionId) {
        return repository.findBySessionIdOrderByTurnAscIdAsc(sessionId);
    }

    public void appendUser(String sessionId, int turn, String text) {
        append(sessionId, turn, "user", text, null);
        log.info("[{}] User: {}", sessionId, text);
    }

    public void appendAssistant(String sessionId, int turn, String text, String action) {
        append(sessionId, turn, "assistant", text, action);
        log.info("[{}] Assistant ({}): {}", sessionId, action, text);
    }

    private void append(String sessionId, int turn, String role, String text, String action) {
        try {
            repository.save(ConversationMessage.builder()
                    .sessionId(sessionId)
                    .turn(turn)
                    .role(role)
                    .content(StringUtils.abbreviate(StringUtils.defaultString(text), 4000))
                    .action(action)
                    .build());
        } catch (DataAccessException e) {
            log.warn("[{}] Failed to archive {} message", sessionId, role, e);
        }
    }
}
