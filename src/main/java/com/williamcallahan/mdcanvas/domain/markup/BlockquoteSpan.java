package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Objects;

/**
 * One quoted line, including its substituted quote glyphs or alert prefix.
 *
 * @param alertType alert category, {@link AlertType#NORMAL} for plain quotes
 * @param depth number of {@code >} markers on the line
 * @param startPos inclusive start in the display text
 * @param endPos exclusive end in the display text
 */
public record BlockquoteSpan(AlertType alertType, int depth, int startPos, int endPos) implements Span {

    public BlockquoteSpan {
        Objects.requireNonNull(alertType, "Alert type cannot be null");
        if (depth < 1) {
            throw new IllegalArgumentException("Blockquote depth must be at least 1");
        }
        Span.requireValidRange(startPos, endPos);
    }
}
