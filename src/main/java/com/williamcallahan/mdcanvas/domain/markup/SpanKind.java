package com.williamcallahan.mdcanvas.domain.markup;

/**
 * The seven span tables of a parse result, with the capacity each starts from when a document has
 * none of that kind.
 */
public enum SpanKind {
    LINK(10),
    HEADING(5),
    STYLE(20),
    LIST_ITEM(10),
    BLOCKQUOTE(5),
    COLOR_TAG(4),
    FONT_TAG(4);

    private final int defaultCapacity;

    SpanKind(int defaultCapacity) {
        this.defaultCapacity = defaultCapacity;
    }

    public int defaultCapacity() {
        return defaultCapacity;
    }
}
