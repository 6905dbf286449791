package com.astroinsight.astroinsight_backend.controller;

import com.astroinsight.astroinsight_backend.exception.SessionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/** Maps exceptions to JSON error bodies. Stack traces stay in the log. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final int MAX_MESSAGE = 300;

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return build(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message, request);
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = ex.getMessage() != null ? truncate(ex.getMessage()) : "Invalid request";
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), message);
        return build(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnknown(Exception ex, HttpServletRequest request) {
        // Spring MVC's own errors (unsupported method, unknown route) keep their status
        if (ex instanceof ErrorResponse mvcError && mvcError.getStatusCode().is4xxClientError()) {
            HttpStatus status = HttpStatus.valueOf(mvcError.getStatusCode().value());
            log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                    request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(), ex.getMessage());
            return build(status, truncate(ex.getMessage()), request);
        }
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                request.getRequestURI(), request.getMethod(), ex.getClass().getSimpleName(),
                truncate(ex.getMessage()), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", request);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), status.getReasonPhrase(), message, request.getRequestURI(), Instant.now()));
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE) return text;
        return text.substring(0, MAX_MESSAGE);
    }

    public record ApiError(int status, String error, String message, String path, Instant timestamp) {}
}
