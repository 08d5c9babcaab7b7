package io.casetime.api;

import io.casetime.core.InvalidIntervalException;
import io.casetime.core.InvalidRegionException;
import io.casetime.core.InvalidRelationTypeException;
import io.casetime.core.NotFoundException;
import io.casetime.core.TemporalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/** Maps the engine's error taxonomy onto {@code {"error": "..."}} responses. */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
        return temporal(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({InvalidIntervalException.class, InvalidRegionException.class,
            InvalidRelationTypeException.class})
    public ResponseEntity<Map<String, Object>> invalid(TemporalException ex) {
        return temporal(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> temporal(HttpStatus status, TemporalException ex) {
        log.warn("{} in scope {} (subject {}): {}", ex.getClass().getSimpleName(), ex.scopeId(), ex.subject(),
                ex.getMessage());
        return body(status, ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }
}
