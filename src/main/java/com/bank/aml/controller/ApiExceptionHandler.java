package com.bank.aml.controller;

import com.bank.aml.exception.AdjudicationTimeoutException;
import com.bank.aml.exception.ExternalServiceUnavailableException;
import com.bank.aml.exception.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain failures to HTTP responses. A transaction that cannot be fully
 * screened gets an error status, never a decision.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<Map<String, String>> handleInvariantViolation(InvariantViolationException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "invalid_input", e.getMessage());
    }

    @ExceptionHandler(AdjudicationTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleTimeout(AdjudicationTimeoutException e) {
        log.warn("Screening timed out: {}", e.getMessage());
        return body(HttpStatus.GATEWAY_TIMEOUT, "deadline_exceeded", e.getMessage());
    }

    @ExceptionHandler(ExternalServiceUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleUnavailable(ExternalServiceUnavailableException e) {
        log.error("Screening failed, {} unavailable: {}", e.getService(), e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
