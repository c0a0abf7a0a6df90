package com.williamcallahan.mdcanvas.domain.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Objects;

/**
 * Markup to parse, measure or render.
 *
 * @param content raw text, possibly with a markup region and directives
 * @param width layout width in pixels, 0 for the configured default
 */
public record MarkupRenderRequest(
    String content,
    @PositiveOrZero(message = "width must be 0 or greater") int width
) {

    /**
     * Creates a request, normalizing missing content to empty and a missing width to the default.
     *
     * @param content raw text
     * @param width layout width, may be null
     * @return normalized request
     */
    @JsonCreator
    public static MarkupRenderRequest create(
            @JsonProperty("content") String content, @JsonProperty("width") Integer width) {
        return new MarkupRenderRequest(content == null ? "" : content, width == null ? 0 : width);
    }

    public MarkupRenderRequest {
        Objects.requireNonNull(content, "Markup content cannot be null");
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
