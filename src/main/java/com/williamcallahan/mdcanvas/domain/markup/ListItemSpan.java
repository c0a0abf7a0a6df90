package com.williamcallahan.mdcanvas.domain.markup;

/**
 * One list line, starting at its substituted bullet glyph.
 *
 * @param startPos inclusive start in the display text (the glyph, after copied indent)
 * @param endPos exclusive end in the display text
 * @param indentLevel nesting level derived from leading spaces
 * @param checked true for a completed task item ({@code - [x]})
 * @param ordered true for {@code <n>.} items
 * @param taskItem true when the line carried a task checkbox
 */
public record ListItemSpan(
    int startPos,
    int endPos,
    int indentLevel,
    boolean checked,
    boolean ordered,
    boolean taskItem
) implements Span {

    public ListItemSpan {
        Span.requireValidRange(startPos, endPos);
        if (indentLevel < 0) {
            throw new IllegalArgumentException("Indent level must be non-negative");
        }
        if (checked && !taskItem) {
            throw new IllegalArgumentException("Only task items can be checked");
        }
    }

    /**
     * Returns a copy closed at the given position.
     *
     * @param closingPos end position at the line break
     * @return closed list item span
     */
    public ListItemSpan closedAt(int closingPos) {
        return new ListItemSpan(startPos, closingPos, indentLevel, checked, ordered, taskItem);
    }
}
