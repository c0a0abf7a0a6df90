package com.williamcallahan.mdcanvas.domain.markup;

import java.awt.Point;
import java.awt.Rectangle;
import java.util.Objects;

/**
 * A {@code [text](url)} link in the display text.
 *
 * <p>Everything except the on-screen bounds is fixed at parse time. The renderer is the only writer of
 * {@link #bounds()}; each render pass resets and recomputes it.</p>
 */
public final class LinkSpan implements Span {

    private final String text;
    private final String url;
    private final int startPos;
    private final int endPos;
    private final Rectangle bounds = new Rectangle();

    /**
     * Creates a link span with empty bounds.
     *
     * @param text link text as shown in the display text
     * @param url non-empty link target
     * @param startPos inclusive start in the display text
     * @param endPos exclusive end in the display text
     */
    public LinkSpan(String text, String url, int startPos, int endPos) {
        this.text = Objects.requireNonNull(text, "Link text cannot be null");
        this.url = Objects.requireNonNull(url, "Link url cannot be null");
        if (url.isEmpty()) {
            throw new IllegalArgumentException("Link url cannot be empty");
        }
        Span.requireValidRange(startPos, endPos);
        this.startPos = startPos;
        this.endPos = endPos;
    }

    public String text() {
        return text;
    }

    public String url() {
        return url;
    }

    @Override
    public int startPos() {
        return startPos;
    }

    @Override
    public int endPos() {
        return endPos;
    }

    /**
     * Returns a copy of the bounds computed by the last render, empty before any render.
     */
    public Rectangle bounds() {
        return new Rectangle(bounds);
    }

    /**
     * Checks whether the last rendered bounds contain a point.
     *
     * @param point point in surface coordinates
     * @return true when the point lies inside non-empty bounds
     */
    public boolean boundsContain(Point point) {
        return !bounds.isEmpty() && bounds.contains(point);
    }

    /**
     * Clears the bounds before a new render pass.
     */
    public void resetBounds() {
        bounds.setBounds(0, 0, 0, 0);
    }

    /**
     * Grows the bounds to include a painted glyph box.
     *
     * @param glyphBox visible part of a glyph belonging to this link
     */
    public void includeInBounds(Rectangle glyphBox) {
        if (glyphBox.isEmpty()) {
            return;
        }
        if (bounds.isEmpty()) {
            bounds.setBounds(glyphBox);
        } else {
            bounds.add(glyphBox);
        }
    }

    @Override
    public String toString() {
        return "LinkSpan[text=" + text + ", url=" + url + ", startPos=" + startPos + ", endPos=" + endPos
            + ", bounds=" + bounds + "]";
    }
}
