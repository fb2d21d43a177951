package com.fieldforce.fieldexecutionbackend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ExecutionValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ExecutionValidationException e) {
        log.info("Rejected transition: {}", e.getMessage());
        Map<String, Object> body = body("validation_failed", e.getMessage());
        body.put("reasons", e.getReasons());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(BackendUnavailableException e) {
        log.warn("Field backend unavailable during {}: {}", e.getMethod(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("backend_unavailable", "Field backend is unreachable, please retry"));
    }

    @ExceptionHandler(BackendRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(BackendRejectedException e) {
        log.warn("Field backend rejected {} ({}): {}", e.getMethod(), e.getStatus(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(body("backend_rejected", e.getMessage()));
    }

    @ExceptionHandler({UnknownSessionException.class, MissingRequestHeaderException.class})
    public ResponseEntity<Map<String, Object>> handleSession(Exception e) {
        return ResponseEntity.badRequest().body(body("session_required", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("bad_request", e.getMessage()));
    }

    @ExceptionHandler(FieldBackendException.class)
    public ResponseEntity<Map<String, Object>> handleBackend(FieldBackendException e) {
        log.error("Unexpected field backend failure during {}", e.getMethod(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("internal_error", "Something went wrong, please try again"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleAll(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("internal_error", "Something went wrong, please try again"));
    }

    private Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
