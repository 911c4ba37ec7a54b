package com.phillippitts.bilingualtts.presentation.exception;

import com.phillippitts.bilingualtts.exception.AssemblyException;
import com.phillippitts.bilingualtts.exception.InvalidInputException;
import com.phillippitts.bilingualtts.exception.NoSegmentsException;
import com.phillippitts.bilingualtts.exception.SynthesisException;
import com.phillippitts.bilingualtts.exception.WorkspaceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping backend details (voices, paths, stderr) away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - blank text, unknown voice (HTTP 400).
     */
    @ExceptionHandler(InvalidInputException.class)
    ResponseEntity<ApiError> handleInvalidInput(InvalidInputException ex) {
        LOG.warn("Invalid input: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid input", ex.getReason());
    }

    /**
     * Client error - request body missing or not JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().toString());
        return respond(HttpStatus.BAD_REQUEST, "InvalidInputException", "Invalid input",
                "Request body must be JSON with a 'text' field");
    }

    /**
     * Text contained nothing speakable (HTTP 422).
     */
    @ExceptionHandler(NoSegmentsException.class)
    ResponseEntity<ApiError> handleNoSegments(NoSegmentsException ex) {
        LOG.warn("No segments produced: inputLength={}", ex.getInputLength());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Nothing to synthesize", "The text contains no speakable content");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(SynthesisException.class)
    ResponseEntity<ApiError> handleSynthesisFailure(SynthesisException ex) {
        LOG.error("Synthesis failed: voice={}", ex.getVoice(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Speech synthesis temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Final audio could not be produced (HTTP 500).
     */
    @ExceptionHandler({AssemblyException.class, WorkspaceException.class})
    ResponseEntity<ApiError> handleAssemblyFailure(RuntimeException ex) {
        LOG.error("Audio assembly failed", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Audio could not be assembled", "Please contact support with request ID");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String errorCode, String message,
                                                    String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(errorCode, message, details, Instant.now()));
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
