package com.williamcallahan.mdcanvas.service.markup;

import java.util.Objects;

/**
 * Read position over a range of the source text.
 *
 * <p>Reads past the range limit return {@link #END}, so recognizers can look ahead without bounds
 * checks. A cursor may cover a sub-range of its source; positions are always absolute source
 * indices.</p>
 */
final class MarkupCursor {

    /** Returned by {@link #peek()} at or beyond the limit. */
    static final char END = '\0';

    private final String source;
    private final int limit;
    private int position;

    MarkupCursor(String source) {
        this(source, 0, source.length());
    }

    MarkupCursor(String source, int start, int limit) {
        this.source = Objects.requireNonNull(source, "Source text cannot be null");
        if (start < 0 || limit > source.length() || start > limit) {
            throw new IllegalArgumentException(
                "Cursor range [" + start + ", " + limit + ") is outside source of length " + source.length());
        }
        this.position = start;
        this.limit = limit;
    }

    /**
     * Opens a cursor over a sub-range of the same source.
     *
     * @param start absolute start index
     * @param end absolute exclusive end, at most this cursor's limit
     * @return independent cursor over the range
     */
    MarkupCursor subRange(int start, int end) {
        if (end > limit) {
            throw new IllegalArgumentException("Sub-range end " + end + " exceeds limit " + limit);
        }
        return new MarkupCursor(source, start, end);
    }

    boolean atEnd() {
        return position >= limit;
    }

    char peek() {
        return peek(0);
    }

    /**
     * Looks ahead without moving.
     *
     * @param offset distance from the current position
     * @return character at the offset, or {@link #END} past the limit
     */
    char peek(int offset) {
        int index = position + offset;
        return index >= 0 && index < limit ? source.charAt(index) : END;
    }

    void advance() {
        advance(1);
    }

    void advance(int count) {
        position = Math.min(limit, position + count);
    }

    /**
     * Checks whether the text at the current position starts with a literal.
     */
    boolean matches(String literal) {
        return matchesAt(position, literal);
    }

    boolean matchesAt(int index, String literal) {
        return index >= 0 && index + literal.length() <= limit && source.startsWith(literal, index);
    }

    int position() {
        return position;
    }

    /**
     * Moves to an absolute position inside the range, past a recognized construct or back after a failed match.
     */
    void reset(int savedPosition) {
        if (savedPosition < 0 || savedPosition > limit) {
            throw new IllegalArgumentException("Cannot reset cursor to " + savedPosition);
        }
        position = savedPosition;
    }

    int limit() {
        return limit;
    }

    String source() {
        return source;
    }

    char charAt(int index) {
        return index >= 0 && index < limit ? source.charAt(index) : END;
    }

    String slice(int from, int to) {
        return source.substring(from, to);
    }

    /**
     * Returns the index of the first line break at or after the current position, or the limit.
     */
    int lineEnd() {
        return lineEndFrom(position);
    }

    int lineEndFrom(int index) {
        for (int scan = index; scan < limit; scan++) {
            char current = source.charAt(scan);
            if (current == '\n' || current == '\r') {
                return scan;
            }
        }
        return limit;
    }

    boolean atLineBreak() {
        return lineBreakLengthAt(position) > 0;
    }

    /**
     * Returns 2 for {@code \r\n}, 1 for a lone {@code \n} or {@code \r}, 0 when no break starts here.
     */
    int lineBreakLengthAt(int index) {
        char current = charAt(index);
        if (current == '\r') {
            return charAt(index + 1) == '\n' ? 2 : 1;
        }
        return current == '\n' ? 1 : 0;
    }

    /**
     * Returns the index just past the line break that ends the line at {@code index}, or the limit.
     */
    int nextLineStartFrom(int index) {
        int lineEnd = lineEndFrom(index);
        return lineEnd + lineBreakLengthAt(lineEnd);
    }

    /**
     * Finds a literal inside {@code [from, to)}.
     *
     * @return absolute index of the first occurrence, or -1
     */
    int indexOf(String literal, int from, int to) {
        int last = Math.min(to, limit) - literal.length();
        for (int scan = Math.max(from, 0); scan <= last; scan++) {
            if (source.startsWith(literal, scan)) {
                return scan;
            }
        }
        return -1;
    }
}
