package com.mystery.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps what the controllers let through onto the same {success, error, type} body they use
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.warn("⚠️ [GameApi] Unreadable request body: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Request body must be a JSON object", e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        logger.error("❌ [GameApi] Unhandled error: {}", e.getMessage(), e);
        String errorMessage = e.getMessage();
        if (errorMessage == null) {
            errorMessage = "Unexpected error: " + e.getClass().getSimpleName();
        }
        return body(HttpStatus.INTERNAL_SERVER_ERROR, errorMessage, e);
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, Exception e) {
        Map<String, Object> error = new HashMap<>();
        error.put("success", false);
        error.put("error", message);
        error.put("type", e.getClass().getSimpleName());
        return ResponseEntity.status(status)
            .header("Content-Type", "application/json;charset=UTF-8")
            .body(error);
    }
}
