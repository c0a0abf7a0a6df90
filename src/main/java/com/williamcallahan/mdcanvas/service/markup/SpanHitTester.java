package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.LinkSpan;
import com.williamcallahan.mdcanvas.domain.markup.Span;
import com.williamcallahan.mdcanvas.domain.markup.SpanTable;
import java.awt.Point;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves display positions and surface points to spans.
 *
 * <p>All lookups scan linearly and return the first match in emission order.</p>
 */
public final class SpanHitTester {

    private SpanHitTester() {}

    /**
     * Finds the first span containing a display position.
     *
     * @param table span table to search
     * @param position display-text position
     * @param <T> span type
     * @return index of the first span whose half-open range contains the position
     */
    public static <T extends Span> OptionalInt positionInSpan(SpanTable<T> table, int position) {
        for (int index = 0; index < table.size(); index++) {
            if (table.get(index).contains(position)) {
                return OptionalInt.of(index);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Returns the first span containing a display position.
     */
    public static <T extends Span> Optional<T> spanAt(SpanTable<T> table, int position) {
        OptionalInt index = positionInSpan(table, position);
        return index.isPresent() ? Optional.of(table.get(index.getAsInt())) : Optional.empty();
    }

    /**
     * Finds the index of the first span that starts at a display position.
     */
    public static <T extends Span> OptionalInt spanStartingAt(SpanTable<T> table, int position) {
        for (int index = 0; index < table.size(); index++) {
            int start = table.get(index).startPos();
            if (start == position) {
                return OptionalInt.of(index);
            }
            if (start > position) {
                break;
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Returns the target of the first link whose rendered bounds contain a point.
     *
     * @param links link table after a render pass
     * @param point point in surface coordinates
     * @return link url, empty when no link was hit
     */
    public static Optional<String> linkUrlAt(SpanTable<LinkSpan> links, Point point) {
        Objects.requireNonNull(point, "Point cannot be null");
        for (LinkSpan link : links) {
            if (link.boundsContain(point)) {
                return Optional.of(link.url());
            }
        }
        return Optional.empty();
    }

    /**
     * Opens the link under a click point.
     *
     * @param links link table after a render pass
     * @param point click point in surface coordinates
     * @param opener host capability that opens the url
     * @return true when a link was hit and the opener accepted it
     */
    public static boolean handleClick(SpanTable<LinkSpan> links, Point point, ResourceOpener opener) {
        Objects.requireNonNull(opener, "Resource opener cannot be null");
        return linkUrlAt(links, point).map(opener::open).orElse(false);
    }
}
