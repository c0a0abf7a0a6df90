package com.williamcallahan.mdcanvas.domain.errors;

/**
 * Common shape of the JSON status payloads returned by the markup endpoints.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns {@code "success"} or {@code "error"}.
     *
     * @return response status
     */
    String status();
}
