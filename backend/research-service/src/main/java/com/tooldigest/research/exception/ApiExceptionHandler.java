package com.tooldigest.research.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Research API exception handler
 */
@RestControllerAdvice(basePackages = "com.tooldigest.research.controller")
@Slf4j
public class ApiExceptionHandler {

    /**
     * 409 keeps {@code status: "already_running"} so clients can branch on it
     * without reading the HTTP code.
     */
    @ExceptionHandler(ResearchAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyRunning(ResearchAlreadyRunningException ex) {
        log.info("Rejected research start: {}", ex.getMessage());

        Map<String, Object> response = createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.CONFLICT.value());
        response.put("status", "already_running");
        response.put("httpStatus", HttpStatus.CONFLICT.value());
        response.put("runId", ex.getRunId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", message);

        return ResponseEntity.badRequest()
                .body(createErrorResponse("INVALID_REQUEST", message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadInput(Exception ex) {
        String message = ex instanceof ServerWebInputException swe && swe.getReason() != null
                ? swe.getReason()
                : ex.getMessage();
        log.warn("Invalid request: {}", message);

        return ResponseEntity.badRequest()
                .body(createErrorResponse("INVALID_REQUEST", message, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(SearchUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleSearchUnavailable(SearchUnavailableException ex) {
        log.error("Search unavailable: {}", ex.getMessage());

        Map<String, Object> response = createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_GATEWAY.value());
        response.put("providers", ex.getFailures());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }

    @ExceptionHandler(ResearchException.class)
    public ResponseEntity<Map<String, Object>> handleResearchException(ResearchException ex) {
        log.error("Research service error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("INTERNAL_ERROR", "An unexpected error occurred",
                        HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());
        return response;
    }
}
