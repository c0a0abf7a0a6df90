package com.williamcallahan.mdcanvas.domain.errors;

import java.util.Objects;

/**
 * Acknowledgement payload for operations that return no data, such as clearing the render cache.
 *
 * @param status always {@code "success"}
 * @param message what was done
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
