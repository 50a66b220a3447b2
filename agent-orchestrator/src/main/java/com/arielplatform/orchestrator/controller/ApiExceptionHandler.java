package com.arielplatform.orchestrator.controller;

import com.arielplatform.common.exception.AgentException;
import com.arielplatform.common.exception.InvalidArgumentException;
import com.arielplatform.common.exception.OutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps control-loop failures to JSON error bodies:
 * invalid argument 400, out of range 422, any other {@link AgentException} 409.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(InvalidArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_argument", ex);
    }

    @ExceptionHandler(OutOfRangeException.class)
    public ResponseEntity<Map<String, Object>> handleOutOfRange(OutOfRangeException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "out_of_range", ex);
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<Map<String, Object>> handleAgentException(AgentException ex) {
        return respond(HttpStatus.CONFLICT, "agent_state", ex);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, AgentException ex) {
        log.warn("Request rejected. status={} component={} message={}",
                 status.value(), ex.getComponent(), ex.getMessage());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("component", ex.getComponent());
        out.put("message", ex.getDetail());
        out.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(out);
    }
}
