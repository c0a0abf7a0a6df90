package com.williamcallahan.mdcanvas.service.render;

import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.font.TextAttribute;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Java2D implementation of {@link DrawingSurface}.
 *
 * <p>Fonts are derived once per family, weight, slant, size and strikethrough combination and
 * cached for the lifetime of the surface. The surface does not own the graphics context; callers
 * dispose it.</p>
 */
public final class Graphics2DSurface implements DrawingSurface {

    private final Graphics2D graphics;
    private final String defaultFamily;
    private final float baseFontSize;
    private final Map<FontKey, Font> fontCache = new HashMap<>();

    private record FontKey(String family, int awtStyle, float size, boolean strikethrough) {}

    /**
     * Wraps a graphics context.
     *
     * @param graphics target context
     * @param defaultFamily family for runs without a font directive
     * @param baseFontSize point size at scale 1.0
     */
    public Graphics2DSurface(Graphics2D graphics, String defaultFamily, float baseFontSize) {
        this.graphics = Objects.requireNonNull(graphics, "Graphics context cannot be null");
        this.defaultFamily = Objects.requireNonNull(defaultFamily, "Default font family cannot be null");
        if (baseFontSize <= 0f) {
            throw new IllegalArgumentException("Base font size must be positive");
        }
        this.baseFontSize = baseFontSize;
    }

    /**
     * Turns on antialiasing and quality hints for text painting.
     */
    public void configureRenderingQuality() {
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    }

    @Override
    public RunMetrics measure(String text, TextRunStyle style) {
        FontMetrics metrics = graphics.getFontMetrics(fontFor(style));
        return new RunMetrics(metrics.stringWidth(text), metrics.getHeight(), metrics.getAscent());
    }

    @Override
    public void drawRun(String text, int x, int yTop, TextRunStyle style) {
        Font font = fontFor(style);
        graphics.setFont(font);
        graphics.setColor(style.color());
        graphics.drawString(text, x, yTop + graphics.getFontMetrics(font).getAscent());
    }

    @Override
    public Rectangle clipBounds() {
        return graphics.getClipBounds();
    }

    @Override
    public boolean canDisplay(char character, TextRunStyle style) {
        return fontFor(style).canDisplay(character);
    }

    Font fontFor(TextRunStyle style) {
        String family = style.monospace() ? Font.MONOSPACED
            : style.fontFamily() != null ? style.fontFamily() : defaultFamily;
        int awtStyle = (style.bold() ? Font.BOLD : Font.PLAIN) | (style.italic() ? Font.ITALIC : Font.PLAIN);
        FontKey key = new FontKey(family, awtStyle, baseFontSize * style.scale(), style.strikethrough());
        return fontCache.computeIfAbsent(key, Graphics2DSurface::createFont);
    }

    private static Font createFont(FontKey key) {
        Font font = new Font(key.family(), key.awtStyle(), 1).deriveFont(key.size());
        if (!key.strikethrough()) {
            return font;
        }
        return font.deriveFont(Map.of(TextAttribute.STRIKETHROUGH, TextAttribute.STRIKETHROUGH_ON));
    }
}
