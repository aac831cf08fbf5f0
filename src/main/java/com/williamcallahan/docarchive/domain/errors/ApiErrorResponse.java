package com.williamcallahan.docarchive.domain.errors;

import java.util.Objects;

/**
 * Error payload: {@code {"status": "error", "message": ..., "details": ...}}.
 *
 * @param status always {@code "error"}
 * @param message client-facing error message
 * @param details optional diagnostic text, {@code null} when absent
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
