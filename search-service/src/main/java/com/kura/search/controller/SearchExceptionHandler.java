package com.kura.search.controller;

import com.kura.search.error.ErrorCode;
import com.kura.search.error.SearchCancelledException;
import com.kura.search.error.SearchException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps the search error taxonomy onto HTTP. Bodies never carry stack traces
 * or backend payloads.
 */
@RestControllerAdvice
public class SearchExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SearchExceptionHandler.class);

    @ExceptionHandler(SearchCancelledException.class)
    public ResponseEntity<Void> handleCancelled(SearchCancelledException ex, HttpServletRequest request) {
        log.info("event=request_cancelled path={}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    @ExceptionHandler(SearchException.class)
    public ResponseEntity<ErrorResponse> handleSearch(SearchException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCode());
        log.info("event=request_failed code={} status={} path={}", ex.getCode(), status.value(), request.getRequestURI());
        return ResponseEntity.status(status).body(errorResponse(status, ex.getCode(), ex.getMessage(), ex.isRetryable(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("event=request_failed code={} path={}", ErrorCode.INTERNAL_ERROR, request.getRequestURI(), ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status)
                .body(errorResponse(status, ErrorCode.INTERNAL_ERROR, "Unexpected error", false, request));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case SERVICE_UNAVAILABLE, REQUEST_CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ErrorResponse errorResponse(
            HttpStatus status,
            ErrorCode code,
            String message,
            boolean retryable,
            HttpServletRequest request
    ) {
        return new ErrorResponse(status.getReasonPhrase(), code.name(), message, retryable, Instant.now(), request.getRequestURI());
    }
}
