package com.phillippitts.voicestream.presentation.exception;

import com.phillippitts.voicestream.exception.EngineUnavailableException;
import com.phillippitts.voicestream.exception.SynthesisBusyException;
import com.phillippitts.voicestream.exception.SynthesisException;
import com.phillippitts.voicestream.exception.UnsupportedFormatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
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

    /** Seconds a client should wait before retrying a busy rejection. */
    static final int RETRY_AFTER_SECONDS = 5;

    /**
     * Client error - format without an encoder (HTTP 400).
     */
    @ExceptionHandler(UnsupportedFormatException.class)
    ResponseEntity<ApiError> handleUnsupportedFormat(UnsupportedFormatException ex) {
        LOG.warn("Unsupported format requested: {}", ex.getFormat());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Unsupported output format",
                "Supported formats: " + String.join(", ", ex.getSupported()),
                Instant.now()
            ));
    }

    /**
     * Client error - missing or malformed parameters (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Saturation - every worker stayed occupied (HTTP 503, retry later).
     */
    @ExceptionHandler(SynthesisBusyException.class)
    ResponseEntity<ApiError> handleBusy(SynthesisBusyException ex) {
        LOG.warn("Rejected request: {} workers busy for {}ms", ex.getPoolSize(), ex.getWaitedMs());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(RETRY_AFTER_SECONDS))
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Speech synthesis is busy",
                "All workers are occupied. Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Configuration/setup error - fail fast on startup, but if encountered at runtime return 503.
     */
    @ExceptionHandler(EngineUnavailableException.class)
    ResponseEntity<ApiError> handleEngineUnavailable(EngineUnavailableException ex) {
        LOG.error("Synthesis engine unavailable", ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Speech synthesis unavailable",
                "Engine not loaded. Contact administrator.",
                Instant.now()
            ));
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(SynthesisException.class)
    ResponseEntity<ApiError> handleSynthesisFailure(SynthesisException ex) {
        LOG.error("Synthesis failed: stage={}", ex.getStage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Speech synthesis temporarily unavailable",
                "Please retry in a few seconds",
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
