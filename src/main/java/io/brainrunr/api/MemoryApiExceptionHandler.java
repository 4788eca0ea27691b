package io.brainrunr.api;

import io.brainrunr.memory.ErrorKind;
import io.brainrunr.memory.MemoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps memory failures onto HTTP statuses, keeping the error kind in the body.
 */
@RestControllerAdvice
public class MemoryApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MemoryApiExceptionHandler.class);

    @ExceptionHandler(MemoryException.class)
    public ResponseEntity<Map<String, Object>> handleMemoryException(MemoryException ex) {
        HttpStatus status = switch (ex.kind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STORE_IO -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (ex.kind() == ErrorKind.STORE_IO) {
            log.error("Memory store error: {}", ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(errorBody(ex.kind(), ex.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(errorBody(ErrorKind.VALIDATION, "Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "An unexpected error occurred", "timestamp", Instant.now().toString()));
    }

    private Map<String, Object> errorBody(ErrorKind kind, String message) {
        return Map.of(
                "error", message == null ? kind.name() : message,
                "kind", kind.name(),
                "timestamp", Instant.now().toString()
        );
    }
}
