package com.sqlbridge.web;

import com.sqlbridge.api.GatewayResponse;
import com.sqlbridge.service.ConnectionException;
import com.sqlbridge.service.GatewayBusyException;
import com.sqlbridge.service.PermissionDeniedException;
import com.sqlbridge.service.ProfileNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps failures that happen before a statement reaches a backend onto the response envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GatewayResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .distinct()
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED",
                details.isEmpty() ? "Input validation failed" : details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GatewayResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Malformed request body");
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<GatewayResponse<Void>> handleProfileNotFound(ProfileNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<GatewayResponse<Void>> handlePermissionDenied(PermissionDeniedException ex) {
        return respond(HttpStatus.FORBIDDEN, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(GatewayBusyException.class)
    public ResponseEntity<GatewayResponse<Void>> handleBusy(GatewayBusyException ex) {
        log.warn(ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<GatewayResponse<Void>> handleConnectionFailure(ConnectionException ex) {
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<GatewayResponse<Void>> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<GatewayResponse<Void>> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<GatewayResponse<Void>> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .body(GatewayResponse.failure(code, message, MDC.get(TraceIdFilter.MDC_TRACE_ID)));
    }
}
