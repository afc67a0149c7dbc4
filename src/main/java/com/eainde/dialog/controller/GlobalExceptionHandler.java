package com.eainde.dialog.controller;

import com.eainde.dialog.exception.DialogRouterException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
@Log4j2
public class GlobalExceptionHandler {

    @ExceptionHandler(DialogRouterException.class)
    public ResponseEntity<Map<String, Object>> handleRouterException(DialogRouterException ex) {
        log.error("Dialog turn failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(ex.getMessage(), ex.getClass().getSimpleName()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(errorBody(ex.getMessage(), ex.getClass().getSimpleName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred", ex.getClass().getSimpleName()));
    }

    private Map<String, Object> errorBody(String message, String type) {
        return Map.of(
                "error", message == null ? "" : message,
                "type", type,
                "timestamp", Instant.now().toString()
        );
    }
}
