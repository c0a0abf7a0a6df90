package com.williamcallahan.mdcanvas.domain.render;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Objects;

/**
 * A click on a rendered markup image.
 *
 * @param content raw text that was rendered
 * @param width layout width used for the render, 0 for the configured default
 * @param x click x in image pixels
 * @param y click y in image pixels
 * @param open whether to hand the hit link to the resource opener
 */
public record MarkupClickRequest(
    String content,
    @PositiveOrZero(message = "width must be 0 or greater") int width,
    int x,
    int y,
    boolean open
) {

    @JsonCreator
    public static MarkupClickRequest create(
            @JsonProperty("content") String content,
            @JsonProperty("width") Integer width,
            @JsonProperty("x") int x,
            @JsonProperty("y") int y,
            @JsonProperty("open") Boolean open) {
        return new MarkupClickRequest(
            content == null ? "" : content, width == null ? 0 : width, x, y, Boolean.TRUE.equals(open));
    }

    public MarkupClickRequest {
        Objects.requireNonNull(content, "Markup content cannot be null");
    }

    public boolean isBlank() {
        return content.isBlank();
    }
}
