package com.z254.cxlens.radar.api;

import com.z254.cxlens.radar.api.dto.ApiError;
import com.z254.cxlens.radar.exception.EmptySeriesException;
import com.z254.cxlens.radar.exception.IllegalStatusTransitionException;
import com.z254.cxlens.radar.exception.IncidentNotFoundException;
import com.z254.cxlens.radar.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to {@link ApiError} responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(IncidentNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalStatusTransitionException.class)
    public ResponseEntity<ApiError> handleIllegalTransition(IllegalStatusTransitionException ex) {
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler({EmptySeriesException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(InvalidConfigurationException ex) {
        log.warn("Rejected request with invalid configuration: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        return respond(ex.getStatusCode(), ex.getReason() != null ? ex.getReason() : ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    private ResponseEntity<ApiError> respond(HttpStatusCode status, String message) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .status(status.value())
                        .error(resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value()))
                        .message(message)
                        .timestamp(Instant.now())
                        .build());
    }
}
