package com.williamcallahan.mdcanvas.domain.render;

/**
 * Height the markup needs at a width, including padding.
 *
 * @param width layout width in pixels
 * @param height image height in pixels
 */
public record MarkupHeightResponse(int width, int height) {

    public MarkupHeightResponse {
        if (width <= 0 || height < 0) {
            throw new IllegalArgumentException("Invalid dimensions " + width + "x" + height);
        }
    }
}
