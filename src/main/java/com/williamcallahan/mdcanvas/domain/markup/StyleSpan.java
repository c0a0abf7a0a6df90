package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Objects;

/**
 * Inline style run such as {@code *italic*}, {@code **bold**} or {@code `code`}.
 *
 * @param kind emphasis kind
 * @param startPos inclusive start in the display text
 * @param endPos exclusive end in the display text
 */
public record StyleSpan(StyleKind kind, int startPos, int endPos) implements Span {

    public StyleSpan {
        Objects.requireNonNull(kind, "Style kind cannot be null");
        Span.requireValidRange(startPos, endPos);
    }
}
