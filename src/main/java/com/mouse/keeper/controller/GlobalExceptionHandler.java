package com.mouse.keeper.controller;

import com.mouse.keeper.exception.AccountConflictException;
import com.mouse.keeper.exception.AccountNotFoundException;
import com.mouse.keeper.exception.AccountStorageException;
import com.mouse.keeper.exception.ApiKeyRejectedException;
import com.mouse.keeper.exception.ChallengeCacheException;
import com.mouse.keeper.exception.GatewayException;
import com.mouse.keeper.exception.SessionException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Locale;

/**
 * Maps every failure to a JSON body; internal exception types never reach the client.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String reason,
            String message,
            String path
    ) {}

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGateway(GatewayException ex, HttpServletRequest req) {
        log.warn("Gateway error {} on {}: {}", ex.getReason().getCode(), req.getRequestURI(), ex.getMessage());
        return error(ex.getReason().getStatus(), ex.getReason().getCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(ApiKeyRejectedException.class)
    public ResponseEntity<ApiError> handleApiKey(ApiKeyRejectedException ex, HttpServletRequest req) {
        return error(HttpStatus.UNAUTHORIZED, "invalid_api_key", ex.getMessage(), req);
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(AccountNotFoundException ex, HttpServletRequest req) {
        return error(HttpStatus.NOT_FOUND, "account_not_found", ex.getMessage(), req);
    }

    @ExceptionHandler(AccountConflictException.class)
    public ResponseEntity<ApiError> handleConflict(AccountConflictException ex, HttpServletRequest req) {
        return error(HttpStatus.CONFLICT, "account_conflict", ex.getMessage(), req);
    }

    @ExceptionHandler(AccountStorageException.class)
    public ResponseEntity<ApiError> handleStorage(AccountStorageException ex, HttpServletRequest req) {
        log.error("Accounts file error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "account_storage", ex.getMessage(), req);
    }

    @ExceptionHandler(ChallengeCacheException.class)
    public ResponseEntity<ApiError> handleChallenge(ChallengeCacheException ex, HttpServletRequest req) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "challenge_unavailable", ex.getMessage(), req);
    }

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<ApiError> handleSession(SessionException ex, HttpServletRequest req) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "session_" + ex.getReason().name().toLowerCase(Locale.ROOT),
                ex.getMessage(), req);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", req);
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String reason, String message, HttpServletRequest req) {
        ApiError body = new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                reason,
                message,
                req.getRequestURI()
        );
        return ResponseEntity.status(status).body(body);
    }
}
