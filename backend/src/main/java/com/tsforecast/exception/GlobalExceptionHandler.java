package com.tsforecast.exception;

import com.tsforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "bad_request", "Invalid JSON body.", request);
    }

    @ExceptionHandler(MalformedBodyException.class)
    public ResponseEntity<ApiError> handleMalformedBody(
            MalformedBodyException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "method_not_allowed",
                     "Method " + ex.getMethod() + " is not supported here.", request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleMediaTypeNotSupported(
            HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        return build(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported_media_type", ex.getMessage(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            NoResourceFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "not_found", "No endpoint " + request.getRequestURI(), request);
    }

    @ExceptionHandler(MissingParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(
            MissingParameterException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ApiError> handleInsufficientData(
            InsufficientDataException ex, HttpServletRequest request) {
        log.warn("Insufficient data: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(WorkerPoolSaturatedException.class)
    public ResponseEntity<ApiError> handleSaturated(
            WorkerPoolSaturatedException ex, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(ForecastServiceException.class)
    public ResponseEntity<ApiError> handlePipelineError(
            ForecastServiceException ex, HttpServletRequest request) {
        log.error("Forecast pipeline failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                     "An unexpected error occurred", request);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message, HttpServletRequest request) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .requestId(MDC.get("requestId"))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
