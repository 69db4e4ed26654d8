package net.deckadvisor.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.deckadvisor.controller.support.ErrorResponseUtils;
import net.deckadvisor.exception.InvalidBatchStateException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine contract violations to HTTP statuses: bad input to 400, a batch session used
 * with a different deck to 409.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ErrorResponseUtils.badRequest("Invalid request", e.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return ErrorResponseUtils.badRequest("Missing header", "Header " + e.getHeaderName() + " is required");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ErrorResponseUtils.badRequest("Malformed request body", null);
    }

    @ExceptionHandler(InvalidBatchStateException.class)
    public ResponseEntity<Map<String, String>> handleInvalidBatchState(InvalidBatchStateException e) {
        log.info("Batch session conflict: {}", e.getMessage());
        return ErrorResponseUtils.conflict("Batch session belongs to a different deck",
            "Reset the session with DELETE /api/decks/recommendations/batch before switching decks");
    }
}
