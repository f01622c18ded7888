package com.z254.prism.api.v1;

import com.z254.prism.api.dto.ErrorResponse;
import com.z254.prism.exception.CollaboratorException;
import com.z254.prism.exception.InvalidInputException;
import com.z254.prism.exception.NotFoundException;
import com.z254.prism.exception.PrismException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Translates exceptions into structured JSON error responses.
 * <p>
 * Invalid input maps to 400, unknown resources to 404, monitoring API failures to 502.
 * Anything else is logged at ERROR and returned as 500.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException exception,
                                                            ServerWebExchange exchange) {
        return createResponse(HttpStatus.BAD_REQUEST, exception, exchange);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException exception,
                                                        ServerWebExchange exchange) {
        return createResponse(HttpStatus.NOT_FOUND, exception, exchange);
    }

    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<ErrorResponse> handleCollaborator(CollaboratorException exception,
                                                            ServerWebExchange exchange) {
        log.warn("Monitoring API error from {}: {}", exception.getCollaborator(), exception.getMessage());
        return createResponse(HttpStatus.BAD_GATEWAY, exception, exchange);
    }

    @ExceptionHandler(PrismException.class)
    public ResponseEntity<ErrorResponse> handlePrism(PrismException exception, ServerWebExchange exchange) {
        log.error("Unmapped PRISM error: {}", exception.getMessage(), exception);
        return createResponse(HttpStatus.INTERNAL_SERVER_ERROR, exception, exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException exception,
                                                          ServerWebExchange exchange) {
        String message = exception.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return createResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message,
                "Check the request body against the API documentation.", exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(ServerWebInputException exception,
                                                        ServerWebExchange exchange) {
        return createResponse(HttpStatus.BAD_REQUEST, InvalidInputException.CODE, exception.getReason(),
                "Check the request parameters.", exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception exception, ServerWebExchange exchange) {
        log.error("Unexpected error handling {}: {}", path(exchange), exception.getMessage(), exception);
        return createResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred", null, exchange);
    }

    // ========== Private Methods ==========

    private ResponseEntity<ErrorResponse> createResponse(HttpStatus status, PrismException exception,
                                                         ServerWebExchange exchange) {
        return createResponse(status, exception.getCode(), exception.getMessage(),
                exception.getSuggestion(), exchange);
    }

    private ResponseEntity<ErrorResponse> createResponse(HttpStatus status, String code, String message,
                                                         String suggestion, ServerWebExchange exchange) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .suggestion(suggestion)
                .path(path(exchange))
                .timestamp(Instant.now())
                .build());
    }

    private String path(ServerWebExchange exchange) {
        return exchange != null ? exchange.getRequest().getPath().value() : null;
    }
}
