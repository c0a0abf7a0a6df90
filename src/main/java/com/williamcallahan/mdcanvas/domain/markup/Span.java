package com.williamcallahan.mdcanvas.domain.markup;

/**
 * A half-open {@code [startPos, endPos)} range into a parsed display text that carries one annotation.
 */
public interface Span {

    /**
     * Returns the first display-text position covered by this span.
     *
     * @return inclusive start position
     */
    int startPos();

    /**
     * Returns the position just past the last covered character.
     *
     * @return exclusive end position
     */
    int endPos();

    /**
     * Checks whether the given display-text position falls inside this span.
     *
     * @param position character position in the display text
     * @return true when {@code startPos <= position < endPos}
     */
    default boolean contains(int position) {
        return position >= startPos() && position < endPos();
    }

    /**
     * Returns the number of display characters covered.
     */
    default int length() {
        return endPos() - startPos();
    }

    /**
     * Validates span bounds; shared by the record compact constructors.
     *
     * @param startPos inclusive start
     * @param endPos exclusive end
     */
    static void requireValidRange(int startPos, int endPos) {
        if (startPos < 0) {
            throw new IllegalArgumentException("Span start must be non-negative: " + startPos);
        }
        if (endPos < startPos) {
            throw new IllegalArgumentException("Span end " + endPos + " precedes start " + startPos);
        }
    }
}
