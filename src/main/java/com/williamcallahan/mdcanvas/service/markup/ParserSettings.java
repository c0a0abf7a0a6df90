package com.williamcallahan.mdcanvas.service.markup;

import java.util.Objects;

/**
 * Tunables of the markup parser.
 *
 * @param regionOpen delimiter that opens the markup region
 * @param regionClose delimiter that closes the markup region
 * @param listIndentWidth leading spaces per list nesting level
 * @param maxSpansPerTable growth bound of each span table
 */
public record ParserSettings(String regionOpen, String regionClose, int listIndentWidth, int maxSpansPerTable) {

    public static final String DEFAULT_REGION_OPEN = "<md>";
    public static final String DEFAULT_REGION_CLOSE = "</md>";
    public static final int DEFAULT_LIST_INDENT_WIDTH = 2;
    public static final int DEFAULT_MAX_SPANS_PER_TABLE = 65_536;

    public ParserSettings {
        Objects.requireNonNull(regionOpen, "Region open delimiter cannot be null");
        Objects.requireNonNull(regionClose, "Region close delimiter cannot be null");
        if (listIndentWidth < 1) {
            throw new IllegalArgumentException("List indent width must be positive");
        }
        if (maxSpansPerTable < 1) {
            throw new IllegalArgumentException("Max spans per table must be positive");
        }
    }

    public static ParserSettings defaults() {
        return new ParserSettings(
            DEFAULT_REGION_OPEN, DEFAULT_REGION_CLOSE, DEFAULT_LIST_INDENT_WIDTH, DEFAULT_MAX_SPANS_PER_TABLE);
    }

    /**
     * Returns a copy with a different table growth bound.
     */
    public ParserSettings withMaxSpansPerTable(int maxSpans) {
        return new ParserSettings(regionOpen, regionClose, listIndentWidth, maxSpans);
    }
}
