package com.example.scenebrain_backend.controller;

import com.example.scenebrain_backend.api.BrainException;
import com.example.scenebrain_backend.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the error taxonomy onto HTTP statuses with a stable {@code code} in the body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BrainException.class)
    public ResponseEntity<ErrorResponse> handleBrain(BrainException ex) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            LOGGER.warn("request failed code={} msg={}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(new ErrorResponse("VALIDATION_FAILED", message));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    static HttpStatus statusFor(String code) {
        return switch (code) {
            case "ENTITY_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "BUSY" -> HttpStatus.CONFLICT;
            case "AMBIGUOUS_INTENT", "NO_CAPABILITY_MATCH" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "CONTEXT_UNAVAILABLE", "MEMORY_STORE_UNAVAILABLE" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "INVOCATION_ERROR" -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
