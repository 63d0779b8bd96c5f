package mta.nzb.checker.exception;

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
        String errorMsg = ex.getMessage() != null ? ex.getMessage() : "";
        logger.warn("Malformed JSON or invalid request body: {}", errorMsg);

        String message = "Invalid request body";

        // Try to extract more specific error message
        if (errorMsg.contains("JSON parse error") || errorMsg.contains("Unexpected character")) {
            message = "Malformed JSON syntax";
        } else if (errorMsg.contains("Required request body is missing")) {
            message = "Request body is required";
        } else if (errorMsg.contains("Cannot deserialize")) {
            message = "Invalid data format in request body";
        } else if (errorMsg.contains("Unrecognized field")) {
            // Extract field name if possible
            int start = errorMsg.indexOf("\"");
            int end = errorMsg.indexOf("\"", start + 1);
            if (start != -1 && end != -1) {
                String fieldName = errorMsg.substring(start + 1, end);
                message = "Unknown field: '" + fieldName + "'";
            } else {
                message = "Request contains unrecognized field";
            }
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("message", message));
    }

    /**
     * Handle malformed or empty NZB documents (422).
     */
    @ExceptionHandler(NzbParseException.class)
    public ResponseEntity<Map<String, String>> handleNzbParse(NzbParseException ex) {
        logger.warn("NZB rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("message", ex.getMessage()));
    }

    /**
     * Handle NZB download failures (502) with the upstream status when there was one.
     */
    @ExceptionHandler(NzbFetchException.class)
    public ResponseEntity<Map<String, Object>> handleNzbFetch(NzbFetchException ex) {
        logger.warn("NZB download failed: url={}, status={}, message={}",
                ex.getUrl(), ex.getHttpStatus(), ex.getMessage());

        Map<String, Object> body = new HashMap<>();
        body.put("message", ex.getMessage());
        body.put("type", "FETCH_FAILED");
        if (ex.getHttpStatus() > 0) {
            body.put("upstreamStatus", ex.getHttpStatus());
        }

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    /**
     * Handle missing provider configuration (503).
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException ex) {
        logger.warn("Health check not possible: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("message", ex.getMessage(), "type", ex.getType()));
    }

    /**
     * Handle interrupted or timed-out checks (504).
     */
    @ExceptionHandler(HealthCheckCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(HealthCheckCancelledException ex) {
        logger.warn("Health check cancelled: type={}, message={}", ex.getType(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(Map.of("message", ex.getMessage(), "type", ex.getType()));
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