package com.checkmate.pos_sync.web;

import com.checkmate.pos_sync.session.LineAccessDeniedException;
import com.checkmate.pos_sync.session.UnauthenticatedException;
import com.checkmate.pos_sync.sync.InvalidBatchException;
import com.checkmate.pos_sync.sync.SyncFaultException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to one JSON shape: {@code {success:false, error, message, details?, timestamp}}.
 *
 * Per-item conditions never get here; they are reported inside the batch
 * response. This covers whole-request rejections and batch aborts.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String SYNC_FAILED = "SYNC_FAILED";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", errors);
    }

    @ExceptionHandler(InvalidBatchException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBatch(InvalidBatchException e) {
        log.warn("Batch rejected: {} {}", e.getMessage(), e.getDetails());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request body is malformed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
                "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticated(UnauthenticatedException e) {
        return respond(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", e.getMessage(), null);
    }

    @ExceptionHandler(LineAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleLineDenied(LineAccessDeniedException e) {
        return respond(HttpStatus.FORBIDDEN, "FORBIDDEN", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(SyncFaultException.class)
    public ResponseEntity<ErrorResponse> handleSyncFault(SyncFaultException e) {
        log.error("Sync fault, batch rolled back", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, SYNC_FAILED, e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error, request rolled back", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, SYNC_FAILED,
                e.getMessage() != null ? e.getMessage() : "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .success(false)
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        boolean success;
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
