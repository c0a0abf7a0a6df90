package com.williamcallahan.mdcanvas.domain.markup;

/**
 * Heading line opened by one to six {@code #} markers.
 *
 * @param level heading level, 1 through 6
 * @param startPos inclusive start in the display text
 * @param endPos exclusive end in the display text
 */
public record HeadingSpan(int level, int startPos, int endPos) implements Span {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;

    public HeadingSpan {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6: " + level);
        }
        Span.requireValidRange(startPos, endPos);
    }

    /**
     * Returns a copy closed at the given position.
     *
     * @param closingPos end position at the line break
     * @return closed heading span
     */
    public HeadingSpan closedAt(int closingPos) {
        return new HeadingSpan(level, startPos, closingPos);
    }
}
