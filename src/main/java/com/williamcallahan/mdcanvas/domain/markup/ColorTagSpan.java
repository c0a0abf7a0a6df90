package com.williamcallahan.mdcanvas.domain.markup;

import java.awt.Color;
import java.util.List;
import java.util.Objects;

/**
 * Text wrapped in {@code <color:VALUE>...</color>}; a value with several stops
 * ({@code #f00_#00f}) paints a left-to-right gradient across the span.
 *
 * @param startPos inclusive start in the display text
 * @param endPos exclusive end in the display text
 * @param value color value as written in the tag
 * @param colors parsed color stops, one to {@link #MAX_COLOR_STOPS}
 */
public record ColorTagSpan(int startPos, int endPos, String value, List<Color> colors) implements Span {

    public static final int MAX_COLOR_STOPS = 8;

    public ColorTagSpan {
        Span.requireValidRange(startPos, endPos);
        Objects.requireNonNull(value, "Color value cannot be null");
        Objects.requireNonNull(colors, "Colors cannot be null");
        if (colors.isEmpty() || colors.size() > MAX_COLOR_STOPS) {
            throw new IllegalArgumentException("Color tags carry 1 to 8 colors: " + colors.size());
        }
        colors = List.copyOf(colors);
    }

    public boolean isGradient() {
        return colors.size() > 1;
    }

    /**
     * Returns the color for a display position, interpolating between stops for gradients.
     *
     * @param position display-text position inside this span
     * @return solid or interpolated color
     */
    public Color colorAt(int position) {
        if (!isGradient() || length() <= 1) {
            return colors.get(0);
        }
        int clamped = Math.max(startPos, Math.min(position, endPos - 1));
        double progress = (double) (clamped - startPos) / (length() - 1);
        double scaled = progress * (colors.size() - 1);
        int segment = Math.min((int) scaled, colors.size() - 2);
        double fraction = scaled - segment;
        return blend(colors.get(segment), colors.get(segment + 1), fraction);
    }

    private static Color blend(Color from, Color to, double fraction) {
        int red = (int) Math.round(from.getRed() + (to.getRed() - from.getRed()) * fraction);
        int green = (int) Math.round(from.getGreen() + (to.getGreen() - from.getGreen()) * fraction);
        int blue = (int) Math.round(from.getBlue() + (to.getBlue() - from.getBlue()) * fraction);
        return new Color(red, green, blue);
    }
}
