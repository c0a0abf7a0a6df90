package com.williamcallahan.mdcanvas.service.render;

import com.williamcallahan.mdcanvas.domain.markup.AlertType;
import java.awt.Color;

/**
 * Fixed layout metrics and colors of rendered markup.
 */
public final class RenderTheme {

    /** Indent per list nesting step, applied once more than the item's level. */
    public static final int LIST_INDENT = 20;
    public static final int BLOCKQUOTE_INDENT = 20;

    public static final Color CODE_COLOR = new Color(200, 0, 0);

    private static final float[] HEADING_SCALES = {1.6f, 1.4f, 1.2f, 1.1f, 1.05f, 1.0f};

    private static final Color NOTE_COLOR = new Color(31, 111, 235);
    private static final Color TIP_COLOR = new Color(26, 127, 55);
    private static final Color IMPORTANT_COLOR = new Color(130, 80, 223);
    private static final Color WARNING_COLOR = new Color(154, 103, 0);
    private static final Color CAUTION_COLOR = new Color(207, 34, 46);
    private static final Color QUOTE_COLOR = new Color(100, 100, 100);

    private RenderTheme() {}

    /**
     * Returns the size multiplier of a heading level, 1 through 6.
     */
    public static float headingScale(int level) {
        int index = Math.max(1, Math.min(level, HEADING_SCALES.length)) - 1;
        return HEADING_SCALES[index];
    }

    public static int listIndent(int indentLevel) {
        return LIST_INDENT * (1 + indentLevel);
    }

    /**
     * Returns the text color of a blockquote.
     */
    public static Color alertColor(AlertType alertType) {
        return switch (alertType) {
            case NOTE -> NOTE_COLOR;
            case TIP -> TIP_COLOR;
            case IMPORTANT -> IMPORTANT_COLOR;
            case WARNING -> WARNING_COLOR;
            case CAUTION -> CAUTION_COLOR;
            case NORMAL -> QUOTE_COLOR;
        };
    }
}
