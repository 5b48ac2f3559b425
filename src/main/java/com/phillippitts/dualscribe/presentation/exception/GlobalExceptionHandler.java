package com.phillippitts.dualscribe.presentation.exception;

import com.phillippitts.dualscribe.exception.AcquisitionException;
import com.phillippitts.dualscribe.exception.ModelNotFoundException;
import com.phillippitts.dualscribe.exception.RecordingStartException;
import com.phillippitts.dualscribe.exception.UnsupportedFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Recording could not start; everything opened was rolled back (HTTP 503).
     */
    @ExceptionHandler(RecordingStartException.class)
    ResponseEntity<ApiError> handleRecordingStart(RecordingStartException ex) {
        LOG.error("Recording start failed: streams={}, suppressed={}", ex.getFailedStreams(),
                ex.getSuppressed().length, ex);
        Throwable cause = ex.getCause();
        String details = cause instanceof ModelNotFoundException
                ? "Recognition model not loaded. Contact administrator."
                : "Failed streams: " + String.join(", ", ex.getFailedStreams());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Recording could not be started",
                details,
                Instant.now()
            ));
    }

    /**
     * Configuration/setup error - model missing at runtime (HTTP 503).
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found at path: {}", ex.getModelPath());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Speech recognition unavailable",
                "Model not loaded. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Audio device could not be opened (HTTP 503).
     */
    @ExceptionHandler(AcquisitionException.class)
    ResponseEntity<ApiError> handleAcquisition(AcquisitionException ex) {
        LOG.warn("Audio acquisition failed: source={}, reason={}", ex.getSource(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Audio source unavailable",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - unsupported audio format (HTTP 400).
     */
    @ExceptionHandler(UnsupportedFormatException.class)
    ResponseEntity<ApiError> handleUnsupportedFormat(UnsupportedFormatException ex) {
        LOG.warn("Unsupported audio format: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unsupported audio format",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - bad parameter such as an unknown stream or export format (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Invalid request body");
        LOG.warn("Validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "ValidationFailed",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Client error - malformed JSON or unknown enum value (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Malformed request body",
                "Request body could not be parsed",
                Instant.now()
            ));
    }

    /**
     * Conflicting state, e.g. start while already recording (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Conflict: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                "Conflict",
                "Request conflicts with current state",
                ex.getMessage(),
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

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
