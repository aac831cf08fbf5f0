package com.williamcallahan.docarchive.web;

import com.williamcallahan.docarchive.domain.errors.ApiErrorResponse;
import com.williamcallahan.docarchive.service.configuration.ConfigurationTypeMismatchException;
import com.williamcallahan.docarchive.service.configuration.UnknownConfigurationKeyException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions raised by the REST controllers to {@link ApiErrorResponse} payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownConfigurationKeyException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownKey(UnknownConfigurationKeyException ex,
                                                             HttpServletRequest request) {
        log.warn("[{}] {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiErrorResponse.error(ex.getMessage(), ex.getKey()));
    }

    @ExceptionHandler(ConfigurationTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(ConfigurationTypeMismatchException ex,
                                                               HttpServletRequest request) {
        log.warn("[{}] {} - {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiErrorResponse.error(ex.getMessage(), ex.getKey().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex,
                                                             HttpServletRequest request) {
        FieldError firstError = ex.getBindingResult().getFieldError();
        String errorMessage = firstError != null ? firstError.getDefaultMessage() : "Invalid request";
        log.warn("[{}] {} - Validation failed: {}", request.getMethod(), request.getRequestURI(), errorMessage);
        return ResponseEntity.badRequest().body(ApiErrorResponse.error(errorMessage));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                 HttpServletRequest request) {
        log.warn("[{}] {} - Unreadable request body", request.getMethod(), request.getRequestURI());
        return ResponseEntity.badRequest().body(ApiErrorResponse.error("Request body is not valid JSON"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("[{}] {} - Unexpected error", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.error("Internal server error"));
    }
}
