package com.williamcallahan.mdcanvas.web;

import com.williamcallahan.mdcanvas.domain.errors.ApiErrorResponse;
import com.williamcallahan.mdcanvas.domain.errors.ApiResponse;
import com.williamcallahan.mdcanvas.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the JSON status payloads shared by the markup endpoints.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response for rejected input.
     *
     * @param status HTTP status
     * @param message why the request was rejected
     * @return error response without details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response for a failed operation, carrying a summary of the cause.
     *
     * @param status HTTP status
     * @param message what failed
     * @param exception cause
     * @return error response with details
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Summarizes an exception and its root cause on one line.
     *
     * @param exception exception to describe
     * @return summary, or null when no exception is given
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder description = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null) {
            description.append(": ").append(exception.getMessage());
        }
        Throwable rootCause = exception;
        while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
            rootCause = rootCause.getCause();
        }
        if (rootCause != exception) {
            description.append(" (caused by ").append(rootCause.getClass().getSimpleName());
            if (rootCause.getMessage() != null) {
                description.append(": ").append(rootCause.getMessage());
            }
            description.append(')');
        }
        return description.toString();
    }
}
