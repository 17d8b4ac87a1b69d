package com.eventledger.ledger.api;

import com.eventledger.core.exception.ActionNotFoundException;
import com.eventledger.core.exception.ReplayInconsistencyException;
import com.eventledger.core.exception.VersionConflictException;
import com.eventledger.ledger.domain.AccountNotFoundException;
import com.eventledger.ledger.domain.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine and ledger failures to HTTP statuses.
 *
 * 404 unknown account/action, 409 conflicts and state violations, 422 a correction
 * or transfer that would overdraw, 400 malformed input, 500 corrupt event history.
 */
@Slf4j
@RestControllerAdvice
public class LedgerExceptionHandler {

    @ExceptionHandler({AccountNotFoundException.class, ActionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not found", ex.getMessage());
    }

    /**
     * Another writer committed first; the client retries the whole request.
     */
    @ExceptionHandler(VersionConflictException.class)
    public ResponseEntity<ErrorResponse> handleVersionConflict(VersionConflictException ex) {
        log.warn("Version conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Concurrent modification detected", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("Illegal state: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "Invalid state", ex.getMessage());
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException ex) {
        log.warn("Insufficient funds: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient funds", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            errors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ValidationErrorResponse(
                HttpStatus.BAD_REQUEST.value(), "Validation failed", errors, Instant.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid argument", ex.getMessage());
    }

    @ExceptionHandler(ReplayInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleReplayInconsistency(ReplayInconsistencyException ex) {
        log.error("Replay inconsistency, event history needs inspection", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Replay inconsistency", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message, Instant.now()));
    }

    public record ErrorResponse(int status, String error, String message, Instant timestamp) {}

    public record ValidationErrorResponse(int status, String error, Map<String, String> validationErrors,
                                          Instant timestamp) {}
}
