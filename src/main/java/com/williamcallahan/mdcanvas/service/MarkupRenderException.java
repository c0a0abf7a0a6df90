package com.williamcallahan.mdcanvas.service;

/**
 * Raised when markup cannot be parsed into spans or rendered into an image.
 */
public class MarkupRenderException extends IllegalStateException {

    public MarkupRenderException(String message) {
        super(message);
    }

    public MarkupRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
