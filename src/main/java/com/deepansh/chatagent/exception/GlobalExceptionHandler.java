package com.deepansh.chatagent.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Error bodies for the REST surface. Sessions never throw out of the
 * orchestrator, so what reaches here is request validation, gateway calls
 * made directly by controllers, and bugs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    public record ApiError(int status, String error, String path, String timestamp) {

        static ResponseEntity<ApiError> of(HttpStatus status, String message, HttpServletRequest request) {
            return ResponseEntity.status(status).body(new ApiError(
                    status.value(),
                    message != null ? message : status.getReasonPhrase(),
                    request.getRequestURI(),
                    Instant.now().toString()));
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ApiError.of(HttpStatus.BAD_REQUEST, fields.isEmpty() ? "Validation failed" : fields, request);
    }

    @ExceptionHandler(ChatGatewayException.class)
    public ResponseEntity<ApiError> handleGateway(ChatGatewayException ex, HttpServletRequest request) {
        log.warn("Chat platform call failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return ApiError.of(HttpStatus.BAD_GATEWAY, ex.getMessage(), request);
    }

    @ExceptionHandler(ReasoningException.class)
    public ResponseEntity<ApiError> handleReasoning(ReasoningException ex, HttpServletRequest request) {
        log.warn("Reasoning service unavailable on {}: {}", request.getRequestURI(), ex.getMessage());
        return ApiError.of(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(AgentException.class)
    public ResponseEntity<ApiError> handleAgent(AgentException ex, HttpServletRequest request) {
        log.error("Agent error on {}", request.getRequestURI(), ex);
        return ApiError.of(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return ApiError.of(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }
}
