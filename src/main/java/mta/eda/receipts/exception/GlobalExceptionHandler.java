package mta.eda.receipts.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * GlobalExceptionHandler
 * Handles API errors for all controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation errors (400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.put(err.getField(), err.getDefaultMessage())
        );

        logger.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> body = new HashMap<>();
        body.put("message", "Validation error");
        body.put("errors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handle malformed JSON or invalid request body (400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleMalformedJson(HttpMessageNotReadableException ex) {
        logger.warn("Malformed JSON or invalid request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("message", "Invalid request body"));
    }

    /**
     * Handle model invariant violations (400).
     */
    @ExceptionHandler(InvalidModelException.class)
    public ResponseEntity<Map<String, String>> handleInvalidModel(InvalidModelException ex) {
        logger.warn("Invalid order data: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("message", ex.getMessage()));
    }

    /**
     * Handle enrichment failures: 400 for a missing lookup key, 504 for transport problems,
     * 502 when the vendor answered with an error or an unexpected document.
     */
    @ExceptionHandler(EnrichmentException.class)
    public ResponseEntity<Map<String, Object>> handleEnrichment(EnrichmentException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case MISSING_KEY -> HttpStatus.BAD_REQUEST;
            case TRANSPORT_FAILURE -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_STATUS, MALFORMED_RESPONSE -> HttpStatus.BAD_GATEWAY;
        };

        if (status == HttpStatus.BAD_REQUEST) {
            logger.warn("Enrichment rejected: reason={}, orderId={}", ex.getReason(), ex.getOrderId());
        } else {
            logger.error("Enrichment failed: reason={}, orderId={}, message={}",
                    ex.getReason(), ex.getOrderId(), ex.getMessage(), ex);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("message", ex.getMessage());
        body.put("reason", ex.getReason().name());
        body.put("orderId", ex.getOrderId());
        if (ex.getStatusCode() != null) {
            body.put("upstreamStatus", ex.getStatusCode());
        }

        return ResponseEntity.status(status).body(body);
    }

    /**
     * Handle all other unhandled exceptions (500).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnhandled(Exception ex) {
        logger.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("message", "Internal server error"));
    }
}
