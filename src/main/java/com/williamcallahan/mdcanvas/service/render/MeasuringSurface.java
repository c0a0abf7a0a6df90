package com.williamcallahan.mdcanvas.service.render;

import java.awt.Rectangle;
import java.util.Objects;

/**
 * Wraps a surface so a full render pass lays out and computes link bounds without painting.
 */
public final class MeasuringSurface implements DrawingSurface {

    private final DrawingSurface delegate;

    public MeasuringSurface(DrawingSurface delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate surface cannot be null");
    }

    @Override
    public RunMetrics measure(String text, TextRunStyle style) {
        return delegate.measure(text, style);
    }

    @Override
    public void drawRun(String text, int x, int yTop, TextRunStyle style) {
        // layout only
    }

    @Override
    public Rectangle clipBounds() {
        return delegate.clipBounds();
    }

    @Override
    public boolean canDisplay(char character, TextRunStyle style) {
        return delegate.canDisplay(character, style);
    }
}
