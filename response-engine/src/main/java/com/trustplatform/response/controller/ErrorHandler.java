package com.trustplatform.response.controller;

import com.trustplatform.common.exception.ResourceNotFoundException;
import com.trustplatform.common.exception.TrustEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ResourceNotFoundException ex) {
        return Map.of(
                "code", "NOT_FOUND",
                "resource_type", ex.getResourceType(),
                "resource_id", ex.getResourceId(),
                "message", ex.getMessage()
        );
    }

    @ExceptionHandler(TrustEngineException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleEngine(TrustEngineException ex) {
        log.warn("[ErrorHandler] REQUEST_REJECTED reason={}", ex.getMessage());
        return Map.of(
                "code", "TRUST_ENGINE_ERROR",
                "message", ex.getMessage()
        );
    }
}
