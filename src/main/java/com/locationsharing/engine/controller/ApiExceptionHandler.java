package com.locationsharing.engine.controller;

import com.locationsharing.engine.exception.AllStrategiesExhaustedException;
import com.locationsharing.engine.exception.TrackingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps core failures to HTTP responses so that enabling sharing never fails
 * silently: the body names the reason.
 *
 * <pre>
 * PERMISSION_DENIED          403
 * PROVIDER_UNAVAILABLE       503
 * ALL_STRATEGIES_EXHAUSTED   503 (+ retryInSeconds)
 * SAMPLE_TIMEOUT             504
 * PUBLISH_FAILURE            502
 * validation errors          400
 * </pre>
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class ApiExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(TrackingException.class)
    public ResponseEntity<Map<String, Object>> handleTrackingException(TrackingException e) {
        HttpStatus status = switch (e.getCode()) {
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case PROVIDER_UNAVAILABLE, ALL_STRATEGIES_EXHAUSTED -> HttpStatus.SERVICE_UNAVAILABLE;
            case SAMPLE_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case PUBLISH_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
        log.warn("Request failed with {}: {}", e.getCode(), e.getMessage());

        Map<String, Object> body = body(status, e.getCode().name(), e.getMessage());
        if (e instanceof AllStrategiesExhaustedException exhausted && exhausted.getRetryIn() != null) {
            body.put("retryInSeconds", exhausted.getRetryIn().toSeconds());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage()));
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", clock.instant().toString());
        return body;
    }
}
