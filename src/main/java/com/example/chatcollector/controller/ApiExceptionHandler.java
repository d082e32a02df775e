package com.example.chatcollector.controller;

import com.example.chatcollector.service.InvalidCollectionConfigException;
import com.example.chatcollector.store.SessionStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionStoreException.class)
    public ResponseEntity<Map<String, Object>> storeUnavailable(SessionStoreException e) {
        logger.error("Session store failure", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("success", false, "error", "session store unavailable", "detail", e.getMessage()));
    }

    @ExceptionHandler(InvalidCollectionConfigException.class)
    public ResponseEntity<Map<String, Object>> invalidConfig(InvalidCollectionConfigException e) {
        logger.warn("Rejected collection config: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(Map.of("success", false, "error", "invalid collection config", "detail", e.getMessage()));
    }
}
