package com.williamcallahan.docarchive.domain.errors;

import java.util.Objects;

/**
 * Success payload: {@code {"status": "success", "message": ...}}.
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {
    private static final String STATUS_SUCCESS = "success";

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Success message is required");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(STATUS_SUCCESS, message);
    }
}
