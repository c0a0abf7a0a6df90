package com.williamcallahan.mdcanvas.domain.errors;

import java.util.Objects;

/**
 * Error payload for a failed markup request.
 *
 * @param status always {@code "error"}
 * @param message what failed, for display
 * @param details exception summary, or null when the failure was a rejected input
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    /**
     * Creates an error for rejected input.
     *
     * @param message why the input was rejected
     * @return error payload without details
     */
    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    /**
     * Creates an error for a failed operation.
     *
     * @param message what failed
     * @param details exception summary
     * @return error payload with details
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
