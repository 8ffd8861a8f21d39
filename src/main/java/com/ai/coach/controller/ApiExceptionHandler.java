package com.ai.coach.controller;

import com.ai.coach.exception.CoachException;
import com.ai.coach.exception.InvalidTurnException;
import com.ai.coach.exception.PersistenceUnavailableException;
import com.ai.coach.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps coaching failures to JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidTurnException.class)
    public ResponseEntity<Map<String, Object>> badRequest(InvalidTurnException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(PersistenceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> unavailable(PersistenceUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(CoachException.class)
    public ResponseEntity<Map<String, Object>> coachFailure(CoachException e) {
        log.warn("Unhandled coaching failure: {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, CoachException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("component", e.getComponent());
        body.put("message", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
