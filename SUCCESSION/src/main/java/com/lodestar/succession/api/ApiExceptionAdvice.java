package com.lodestar.succession.api;

import com.lodestar.succession.domain.error.AuthorizationException;
import com.lodestar.succession.domain.error.ConflictException;
import com.lodestar.succession.domain.error.EligibilityComputationException;
import com.lodestar.succession.domain.error.NotFoundException;
import com.lodestar.succession.domain.error.StateTransitionException;
import com.lodestar.succession.domain.error.SuccessionException;
import com.lodestar.succession.domain.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies carrying the blocking stage, guard and field errors.
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, ex);
        body.put("fieldErrors", ex.getFieldErrors());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<Map<String, Object>> handleAuthorization(AuthorizationException ex) {
        return respond(HttpStatus.FORBIDDEN, ex);
    }

    @ExceptionHandler(StateTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleTransition(StateTransitionException ex) {
        Map<String, Object> body = body(HttpStatus.CONFLICT, ex);
        body.put("from", ex.getFrom() != null ? ex.getFrom().name() : null);
        body.put("to", ex.getTo() != null ? ex.getTo().name() : null);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConflictException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(EligibilityComputationException.class)
    public ResponseEntity<Map<String, Object>> handleEligibility(EligibilityComputationException ex) {
        log.warn("Eligibility data unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(SuccessionException.class)
    public ResponseEntity<Map<String, Object>> handleOther(SuccessionException ex) {
        log.error("Unmapped succession error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.BAD_REQUEST.value());
        body.put("error", HttpStatus.BAD_REQUEST.getReasonPhrase());
        body.put("message", ex.getReason());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.badRequest().body(body);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, SuccessionException ex) {
        return ResponseEntity.status(status).body(body(status, ex));
    }

    private static Map<String, Object> body(HttpStatus status, SuccessionException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", ex.getMessage());
        body.put("timestamp", Instant.now().toString());
        body.put("stage", ex.getStage() != null ? ex.getStage().name() : null);
        body.put("guard", ex.getGuard());
        return body;
    }
}
