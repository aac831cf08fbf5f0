package com.williamcallahan.docarchive.domain.errors;

/**
 * Common shape of the JSON status payloads returned by the configuration API.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns {@code "success"} or {@code "error"}.
     */
    String status();
}
