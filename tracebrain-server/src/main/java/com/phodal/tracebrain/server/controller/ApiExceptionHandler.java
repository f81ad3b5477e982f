package com.phodal.tracebrain.server.controller;

import com.phodal.tracebrain.error.ErrorCode;
import com.phodal.tracebrain.error.TraceBrainException;
import com.phodal.tracebrain.error.ValidationException;
import com.phodal.tracebrain.server.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps engine error codes onto HTTP statuses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TraceBrainException.class)
    public ResponseEntity<ErrorResponse> handleEngineError(TraceBrainException e, HttpServletRequest request) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        } else {
            log.debug("{} {} rejected: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        }
        String spanId = e instanceof ValidationException validation ? validation.getSpanId() : null;
        return respond(status, e.getCode().name(), e.getMessage(), request, spanId);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.debug("Malformed request to {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION.name(), e.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error on {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "Internal server error", request, null);
    }

    static HttpStatus statusOf(ErrorCode code) {
        return switch (code) {
            case VALIDATION, DANGLING_PARENT, CYCLE_DETECTED -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case TRANSLATION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PROVIDER_ERROR -> HttpStatus.BAD_GATEWAY;
            case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
            case STORAGE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request, String spanId) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .spanId(spanId)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
