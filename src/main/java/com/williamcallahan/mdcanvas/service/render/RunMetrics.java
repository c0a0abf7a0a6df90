package com.williamcallahan.mdcanvas.service.render;

/**
 * Extent of a measured text run.
 *
 * @param width advance width in pixels
 * @param height line height in pixels
 * @param ascent distance from the top of the line to the baseline
 */
public record RunMetrics(int width, int height, int ascent) {

    public RunMetrics {
        if (width < 0 || height < 0 || ascent < 0) {
            throw new IllegalArgumentException("Run metrics must be non-negative");
        }
    }
}
