package com.williamcallahan.mdcanvas.domain.render;

/**
 * Outcome of a click.
 *
 * @param hit whether the point fell on a link
 * @param url link target, null when nothing was hit
 * @param opened whether the link was handed to the resource opener successfully
 */
public record MarkupClickResponse(boolean hit, String url, boolean opened) {

    public static MarkupClickResponse miss() {
        return new MarkupClickResponse(false, null, false);
    }
}
