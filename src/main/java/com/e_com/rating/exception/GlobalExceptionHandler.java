package com.e_com.rating.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps every failure of the review API to a typed JSON error body.
 * Nothing here retries; the caller always sees the failure.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ReviewValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ReviewValidationException ex) {
        log.warn("Rejected review input on '{}': {}", ex.getField(), ex.getMessage());

        Map<String, Object> response = body("VALIDATION_ERROR", ex.getMessage());
        response.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Rejected request body: {}", message);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("VALIDATION_ERROR", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("VALIDATION_ERROR", "Malformed request"));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("{} lookup failed for {}", ex.getResourceType(), ex.getIdentifier());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", ex.getMessage()));
    }

    /**
     * Capability checks from {@code @PreAuthorize} end up here once the request reached the controller.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Capability check failed: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("FORBIDDEN", "Insufficient capability for this operation"));
    }

    @ExceptionHandler({TransactionException.class, DataAccessException.class})
    public ResponseEntity<Map<String, Object>> handleTransactionFailure(RuntimeException ex) {
        log.error("Review transaction rolled back: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("TRANSACTION_FAILED", "The operation was rolled back, no changes were applied"));
    }

    /**
     * Spring MVC's own request errors (unsupported media type, unknown route, wrong method)
     * keep the status they carry.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());

            HttpStatus resolved = HttpStatus.resolve(status.value());
            String error = resolved != null ? resolved.name() : "REQUEST_ERROR";
            return ResponseEntity.status(status).body(body(error, ex.getMessage()));
        }

        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    public static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
        return response;
    }
}
