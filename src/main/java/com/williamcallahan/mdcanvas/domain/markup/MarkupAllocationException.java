package com.williamcallahan.mdcanvas.domain.markup;

/**
 * Signals that a span table could not grow during a parse.
 */
public class MarkupAllocationException extends IllegalStateException {

    /**
     * Creates an allocation failure with a summary.
     *
     * @param message failure summary
     */
    public MarkupAllocationException(String message) {
        super(message);
    }

    /**
     * Creates an allocation failure with context and root cause.
     *
     * @param message failure summary
     * @param cause the underlying failure
     */
    public MarkupAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
