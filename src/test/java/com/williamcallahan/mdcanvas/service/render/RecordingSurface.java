package com.williamcallahan.mdcanvas.service.render;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-metric surface that records painted runs.
 */
final class RecordingSurface implements DrawingSurface {

    static final int GLYPH_WIDTH = 10;
    static final int LINE_HEIGHT = 16;
    static final int ASCENT = 12;

    record DrawnRun(String text, int x, int yTop, TextRunStyle style) {}

    final List<DrawnRun> drawn = new ArrayList<>();
    private final Rectangle clip;

    RecordingSurface() {
        this(null);
    }

    RecordingSurface(Rectangle clip) {
        this.clip = clip;
    }

    @Override
    public RunMetrics measure(String text, TextRunStyle style) {
        return new RunMetrics(text.length() * GLYPH_WIDTH, LINE_HEIGHT, ASCENT);
    }

    @Override
    public void drawRun(String text, int x, int yTop, TextRunStyle style) {
        drawn.add(new DrawnRun(text, x, yTop, style));
    }

    @Override
    public Rectangle clipBounds() {
        return clip == null ? null : new Rectangle(clip);
    }

    @Override
    public boolean canDisplay(char character, TextRunStyle style) {
        return character != '\u0007';
    }

    String paintedText() {
        StringBuilder text = new StringBuilder();
        drawn.forEach(run -> text.append(run.text()));
        return text.toString();
    }
}
