package com.williamcallahan.mdcanvas.web;

import com.williamcallahan.mdcanvas.domain.errors.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Shared error and acknowledgement responses for controllers.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Maps a failed operation to a 500 response.
     *
     * @param exception the failure
     * @param operation what was being done, phrased to follow "Failed to"
     * @return error response
     */
    protected ResponseEntity<ApiResponse> handleServiceException(Exception exception, String operation) {
        return exceptionBuilder.buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, exception);
    }

    /**
     * Maps rejected input to a 400 response.
     *
     * @param validationException why the input was rejected
     * @return error response
     */
    protected ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
