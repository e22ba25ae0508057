package com.buddy.engine.api;

import com.buddy.engine.error.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as {@code {error, kind, timestamp}} with a status
 * derived from the exception's kind.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngine(EngineException ex) {
        return body(statusOf(ex.getKind()), ex.getMessage(), ex.getKind().name());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "BAD_REQUEST");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request body", "BAD_REQUEST");
    }

    @ExceptionHandler(TypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(TypeMismatchException ex) {
        return body(HttpStatus.BAD_REQUEST, "Invalid value: " + ex.getValue(), "BAD_REQUEST");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // Unknown route, wrong method, bad path variable and the like.
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            return body(status == null ? HttpStatus.BAD_REQUEST : status, ex.getMessage(), "HTTP");
        }
        log.error("Unhandled API error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "INTERNAL");
    }

    static HttpStatus statusOf(EngineException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case UNKNOWN_TYPE -> HttpStatus.BAD_REQUEST;
            case INVALID_TRANSITION, NOT_AWAITING_APPROVAL, ALREADY_RESPONDED, CONCURRENCY_LIMIT -> HttpStatus.CONFLICT;
            case POLICY -> HttpStatus.FORBIDDEN;
            case SPAWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? status.getReasonPhrase() : message);
        body.put("kind", kind);
        body.put("timestamp", Instant.now());
        return ResponseEntity.status(status).body(body);
    }
}
