package com.ai.coach.controller;

import com.ai.coach.component.ConversationStore;
import com.ai.coach.dto.CreateSessionRequest;
import com.ai.coach.dto.SessionSnapshot;
import com.ai.coach.dto.SessionSummary;
import com.ai.coach.dto.TurnRequest;
import com.ai.coach.dto.TurnResponse;
import com.ai.coach.entity.ConversationMessage;
import com.ai.coach.service.CoachingTurnService;
import com.ai.coach.service.LlmDecisionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final CoachingTurnService turnService;
    private final ConversationStore conversationStore;
    private final LlmDecisionService llmDecisionService;

    public SessionController(CoachingTurnService turnService,
                             ConversationStore conversationStore,
                             LlmDecisionService llmDecisionService) {
        this.turnService = turnService;
        this.conversationStore = conversationStore;
        this.llmDecisionService = llmDecisionService;
    }

    @PostMapping("/sessions")
    public ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) CreateSessionRequest request) {
        CoachingTurnService.SessionStarted started = turnService.start(request != null ? request.getSessionId() : null);
        log.info("Session started | sessionId={}", started.getSession().getSessionId());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("session", started.getSession());
        body.put("reply", started.getOpening());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/sessions/{sessionId}/turns")
    public ResponseEntity<TurnResponse> turn(@PathVariable String sessionId,
                                             @RequestBody(required = false) TurnRequest request) {
        return ResponseEntity.ok(turnService.takeTurn(sessionId, request != null ? request.getUserText() : null));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionSnapshot> snapshot(@PathVariable String sessionId) {
        return ResponseEntity.ok(turnService.snapshot(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<List<Map<String, Object>>> messages(@PathVariable String sessionId) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ConversationMessage m : conversationStore.getHistory(sessionId)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("turn", m.getTurn());
            row.put("role", m.getRole());
            row.put("content", m.getContent());
            if (m.getAction() != null) row.put("action", m.getAction());
            row.put("createdAt", m.getCreatedAt());
            out.add(row);
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionSummary>> list() {
        return ResponseEntity.ok(turnService.list());
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        turnService.end(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("generativeEnabled", llmDecisionService.isEnabled());
        return body;
    }
}
