package com.voice_agent_backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.voice_agent_backend.controllers")
@Slf4j
public class VoiceAgentExceptionHandler {

    /**
     * Handle missing agents and other lookups that found nothing
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<?> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(e.getMessage(), "NOT_FOUND"));
    }

    /**
     * Handle missing or invalid credentials and agent configuration
     */
    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<?> handleConfiguration(ConfigurationException e) {
        log.error("Configuration error: {}", e.getMessage());
        Map<String, Object> body = errorBody(e.getMessage(), "CONFIGURATION_ERROR");
        if (e.getSessionId() != null) {
            body.put("sessionId", e.getSessionId());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<?> handleUpstreamUnavailable(UpstreamUnavailableException e) {
        log.error("Realtime service unavailable: {}", e.getMessage());
        Map<String, Object> body = errorBody("Voice AI service is temporarily unavailable", "UPSTREAM_UNAVAILABLE");
        body.put("retryable", true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<?> handleRateLimit(RateLimitExceededException e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());
        Map<String, Object> body = errorBody(e.getMessage(), "RATE_LIMIT_EXCEEDED");
        body.put("retryAfter", e.getRetryAfterSeconds() + " seconds");
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", String.valueOf(e.getRetryAfterSeconds()))
                .body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        Map<String, Object> body = errorBody("Request validation failed", "VALIDATION_ERROR");
        Map<String, String> fields = new HashMap<>();
        e.getBindingResult().getFieldErrors()
                .forEach(error -> fields.put(error.getField(), error.getDefaultMessage()));
        body.put("fields", fields);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Validation error: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getMessage(), "VALIDATION_ERROR"));
    }

    private Map<String, Object> errorBody(String message, String type) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        errorResponse.put("type", type);
        errorResponse.put("timestamp", LocalDateTime.now());
        return errorResponse;
    }

    // Custom exception classes

    /**
     * Credentials or agent configuration are missing or invalid. Fatal for the session, never retried.
     */
    public static class ConfigurationException extends RuntimeException {
        private final String sessionId;

        public ConfigurationException(String message, String sessionId) {
            super(message);
            this.sessionId = sessionId;
        }

        public String getSessionId() {
            return sessionId;
        }
    }

    /**
     * The realtime model service could not be reached, configured, or written to.
     */
    public static class UpstreamUnavailableException extends RuntimeException {
        private final String sessionId;

        public UpstreamUnavailableException(String message, String sessionId) {
            super(message);
            this.sessionId = sessionId;
        }

        public UpstreamUnavailableException(String message, String sessionId, Throwable cause) {
            super(message, cause);
            this.sessionId = sessionId;
        }

        public String getSessionId() {
            return sessionId;
        }
    }

    public static class NotFoundException extends RuntimeException {
        public NotFoundException(String message) {
            super(message);
        }
    }

    public static class RateLimitExceededException extends RuntimeException {
        private final int retryAfterSeconds;

        public RateLimitExceededException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }

    public static class UnknownToolException extends RuntimeException {
        public UnknownToolException(String toolName) {
            super("Unknown tool: " + toolName);
        }
    }

    /**
     * A tool handler rejected its argument payload.
     */
    public static class InvalidToolArgumentsException extends RuntimeException {
        public InvalidToolArgumentsException(String message) {
            super(message);
        }

        public InvalidToolArgumentsException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A downstream collaborator failed while a tool was running.
     */
    public static class ToolExecutionException extends RuntimeException {
        public ToolExecutionException(String message) {
            super(message);
        }

        public ToolExecutionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class DuplicateToolCallException extends RuntimeException {
        private final String callId;

        public DuplicateToolCallException(String callId) {
            super("Tool call already open: " + callId);
            this.callId = callId;
        }

        public String getCallId() {
            return callId;
        }
    }
}
