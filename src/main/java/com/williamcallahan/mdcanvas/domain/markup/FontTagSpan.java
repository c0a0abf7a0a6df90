package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Objects;

/**
 * Text wrapped in {@code <font:NAME>...</font>}.
 *
 * @param startPos inclusive start in the display text
 * @param endPos exclusive end in the display text
 * @param fontName font family requested by the tag
 */
public record FontTagSpan(int startPos, int endPos, String fontName) implements Span {

    public static final int MAX_FONT_NAME_LENGTH = 64;

    public FontTagSpan {
        Span.requireValidRange(startPos, endPos);
        Objects.requireNonNull(fontName, "Font name cannot be null");
        if (fontName.isBlank() || fontName.length() > MAX_FONT_NAME_LENGTH) {
            throw new IllegalArgumentException("Font name must be 1 to 64 characters");
        }
    }
}
