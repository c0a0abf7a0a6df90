package com.williamcallahan.mdcanvas.service.render;

import java.awt.Rectangle;

/**
 * Text painting capabilities the renderer needs from its host.
 */
public interface DrawingSurface {

    /**
     * Measures a run in a style without painting it.
     */
    RunMetrics measure(String text, TextRunStyle style);

    /**
     * Paints a run.
     *
     * @param text run text
     * @param x left edge of the run
     * @param yTop top of the run's line box
     * @param style run style
     */
    void drawRun(String text, int x, int yTop, TextRunStyle style);

    /**
     * Returns the current clip rectangle, or null when painting is unclipped.
     */
    Rectangle clipBounds();

    /**
     * Checks whether a glyph exists for a character in a style.
     */
    boolean canDisplay(char character, TextRunStyle style);
}
