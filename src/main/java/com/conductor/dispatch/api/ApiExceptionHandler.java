package com.conductor.dispatch.api;

import com.conductor.core.error.CircularDependencyException;
import com.conductor.core.error.ConductorException;
import com.conductor.core.error.ManifestValidationException;
import com.conductor.core.error.ServiceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the exception hierarchy to HTTP statuses for the REST API.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ServiceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(ServiceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(CircularDependencyException.class)
    public ResponseEntity<Map<String, Object>> circular(CircularDependencyException e) {
        ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, e);
        response.getBody().put("cycle", e.getCycle());
        return response;
    }

    @ExceptionHandler({ManifestValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ConductorException.class)
    public ResponseEntity<Map<String, Object>> failure(ConductorException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
