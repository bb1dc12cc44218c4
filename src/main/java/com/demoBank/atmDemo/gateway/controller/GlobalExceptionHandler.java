package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.common.exception.ResponseCode;
import com.demoBank.atmDemo.gateway.exception.RateLimitExceededException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Global exception handler. Domain failures keep their kind; clients read the response code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AtmException.class)
    public ResponseEntity<ErrorResponse> handleAtmException(AtmException ex) {
        if (ex.isTerminal()) {
            log.warn("Terminal error - kind: {}, subKind: {}, message: {}", ex.getKind(), ex.getSubKind(), ex.getMessage());
        } else {
            log.info("Request rejected - kind: {}, message: {}", ex.getKind(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getKind().getHttpStatus())
                .body(new ErrorResponse(ex.getKind().name(), ex.getSubKind(), ex.getResponseCode().getCode(),
                        ex.getMessage(), ex.getDetails().isEmpty() ? null : ex.getDetails(), ex.isTerminal()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);
        return validationError(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableMessage(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return validationError("Request body is malformed or contains unknown fields");
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        log.warn("Rate limit exceeded: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("RATE_LIMIT_EXCEEDED", null, ResponseCode.ISSUER_UNAVAILABLE.getCode(),
                        ex.getMessage(), null, false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", null, ResponseCode.ISSUER_UNAVAILABLE.getCode(),
                        "An unexpected error occurred", null, false));
    }

    private static ResponseEntity<ErrorResponse> validationError(String message) {
        return ResponseEntity.status(ErrorKind.VALIDATION_ERROR.getHttpStatus())
                .body(new ErrorResponse(ErrorKind.VALIDATION_ERROR.name(), null,
                        ErrorKind.VALIDATION_ERROR.getResponseCode().getCode(), message, null, false));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorResponse(String code, String subKind, String responseCode, String message,
                         Map<String, Object> details, boolean terminal) {}
}
