package com.versionrace.api.rest;

import com.versionrace.core.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain errors to HTTP responses carrying the error code.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({DuplicateKeyException.class, ConcurrentUpdateException.class})
    public ResponseEntity<ErrorResponse> handleConflict(VersionRaceException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException e) {
        log.error("Storage failure [{}]: {}", e.getErrorCode(), e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(OperationTimeoutException e) {
        log.warn("Request timed out: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    /**
     * Rejected request values, such as a negative hold or a non-positive timeout.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(INVALID_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(VersionRaceException.class)
    public ResponseEntity<ErrorResponse> handleOther(VersionRaceException e) {
        log.error("Unhandled domain error [{}]: {}", e.getErrorCode(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, VersionRaceException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
