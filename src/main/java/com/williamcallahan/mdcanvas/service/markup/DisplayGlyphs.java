package com.williamcallahan.mdcanvas.service.markup;

/**
 * Characters substituted into the display text for block markers.
 */
public final class DisplayGlyphs {

    public static final String BULLET = "• ";
    public static final String TASK_UNCHECKED = "□ ";
    public static final String TASK_CHECKED = "■ ";
    public static final char QUOTE_BAR = '▌';
    public static final String HORIZONTAL_RULE = "───";

    private DisplayGlyphs() {}
}
