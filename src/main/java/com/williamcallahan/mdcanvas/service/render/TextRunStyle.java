package com.williamcallahan.mdcanvas.service.render;

import java.awt.Color;
import java.util.Objects;

/**
 * Visual attributes shared by every glyph of a painted run.
 *
 * @param fontFamily requested family, or null for the surface default
 * @param scale size multiplier over the surface base size
 * @param bold bold weight
 * @param italic italic slant
 * @param monospace monospaced family, overriding {@code fontFamily}
 * @param strikethrough line through the run
 * @param color text color
 */
public record TextRunStyle(
    String fontFamily,
    float scale,
    boolean bold,
    boolean italic,
    boolean monospace,
    boolean strikethrough,
    Color color
) {

    public TextRunStyle {
        Objects.requireNonNull(color, "Run color cannot be null");
        if (scale <= 0f) {
            throw new IllegalArgumentException("Run scale must be positive: " + scale);
        }
    }

    /**
     * Returns the unadorned default style in a color.
     */
    public static TextRunStyle plain(Color color) {
        return new TextRunStyle(null, 1.0f, false, false, false, false, color);
    }
}
