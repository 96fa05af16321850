package com.phillippitts.slawatch.presentation.exception;

import com.phillippitts.slawatch.exception.InvalidMeasurementException;
import com.phillippitts.slawatch.exception.LocalStorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid measurement (HTTP 400).
     */
    @ExceptionHandler(InvalidMeasurementException.class)
    ResponseEntity<ApiError> handleInvalidMeasurement(InvalidMeasurementException ex) {
        LOG.warn("Invalid measurement: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        LOG.warn("Rejected request: {}", details);
        return badRequest("ValidationFailed", details);
    }

    /**
     * Client error - unreadable JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return badRequest("MalformedRequest", "Request body is not valid JSON for this endpoint");
    }

    /**
     * Backlog unwritable - telemetry durability is at risk (HTTP 503).
     */
    @ExceptionHandler(LocalStorageException.class)
    ResponseEntity<ApiError> handleLocalStorage(LocalStorageException ex) {
        LOG.error("CRITICAL: local telemetry storage failed at {}", ex.getLocation(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Telemetry storage temporarily unavailable",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String errorCode, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, "Invalid measurement", details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
