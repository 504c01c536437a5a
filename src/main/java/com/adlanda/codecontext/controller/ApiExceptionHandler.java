package com.adlanda.codecontext.controller;

import com.adlanda.codecontext.embedding.ProviderException;
import com.adlanda.codecontext.service.SourceFileNotFoundException;
import com.adlanda.codecontext.service.SourceFileTooLargeException;
import com.adlanda.codecontext.service.UnsupportedSourceFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProvider(ProviderException ex) {
        log.warn("Embedding provider failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "embedding_provider_failed", ex.getMessage());
    }

    @ExceptionHandler(SourceFileNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SourceFileNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "file_not_found", ex.getMessage());
    }

    @ExceptionHandler(UnsupportedSourceFileException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupported(UnsupportedSourceFileException ex) {
        return error(HttpStatus.BAD_REQUEST, "file_excluded", ex.getMessage());
    }

    @ExceptionHandler(SourceFileTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(SourceFileTooLargeException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "file_too_large", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", code,
                "message", message == null ? "" : message
        ));
    }
}
