package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.ColorTagSpan;
import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parses the value of a {@code <color:VALUE>} directive.
 *
 * <p>Accepted stop formats are {@code #RGB}, {@code #RRGGBB}, {@code rgb(r,g,b)} and a fixed set of
 * CSS color names. Up to eight stops joined by {@code _} form a gradient, e.g. {@code red_#00f}.
 * A value with any unreadable stop is rejected as a whole.</p>
 */
final class ColorValueParser {

    private static final char STOP_SEPARATOR = '_';
    private static final String RGB_PREFIX = "rgb(";
    private static final int CHANNEL_MAX = 255;

    private static final Map<String, Color> NAMED_COLORS = Map.ofEntries(
        Map.entry("black", new Color(0, 0, 0)),
        Map.entry("white", new Color(255, 255, 255)),
        Map.entry("red", new Color(255, 0, 0)),
        Map.entry("green", new Color(0, 128, 0)),
        Map.entry("lime", new Color(0, 255, 0)),
        Map.entry("blue", new Color(0, 0, 255)),
        Map.entry("yellow", new Color(255, 255, 0)),
        Map.entry("cyan", new Color(0, 255, 255)),
        Map.entry("aqua", new Color(0, 255, 255)),
        Map.entry("magenta", new Color(255, 0, 255)),
        Map.entry("fuchsia", new Color(255, 0, 255)),
        Map.entry("orange", new Color(255, 165, 0)),
        Map.entry("purple", new Color(128, 0, 128)),
        Map.entry("pink", new Color(255, 192, 203)),
        Map.entry("gray", new Color(128, 128, 128)),
        Map.entry("grey", new Color(128, 128, 128)),
        Map.entry("silver", new Color(192, 192, 192)),
        Map.entry("maroon", new Color(128, 0, 0)),
        Map.entry("olive", new Color(128, 128, 0)),
        Map.entry("teal", new Color(0, 128, 128)),
        Map.entry("navy", new Color(0, 0, 128)),
        Map.entry("brown", new Color(165, 42, 42)),
        Map.entry("gold", new Color(255, 215, 0)),
        Map.entry("indigo", new Color(75, 0, 130)),
        Map.entry("violet", new Color(238, 130, 238)),
        Map.entry("coral", new Color(255, 127, 80)),
        Map.entry("crimson", new Color(220, 20, 60)),
        Map.entry("turquoise", new Color(64, 224, 208)));

    private ColorValueParser() {}

    /**
     * Parses a color value into one or more stops.
     *
     * @param value text between {@code <color:} and {@code >}
     * @return color stops, or empty when the value is not a valid color or gradient
     */
    static Optional<List<Color>> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        List<Color> stops = new ArrayList<>();
        int segmentStart = 0;
        for (int index = 0; index <= value.length(); index++) {
            if (index == value.length() || value.charAt(index) == STOP_SEPARATOR) {
                Optional<Color> stop = parseStop(value.substring(segmentStart, index).strip());
                if (stop.isEmpty() || stops.size() == ColorTagSpan.MAX_COLOR_STOPS) {
                    return Optional.empty();
                }
                stops.add(stop.get());
                segmentStart = index + 1;
            }
        }
        return Optional.of(List.copyOf(stops));
    }

    static Optional<Color> parseStop(String stop) {
        if (stop.isEmpty()) {
            return Optional.empty();
        }
        if (stop.charAt(0) == '#') {
            return parseHex(stop.substring(1));
        }
        String lower = stop.toLowerCase(Locale.ROOT);
        if (lower.startsWith(RGB_PREFIX) && lower.endsWith(")")) {
            return parseRgb(lower.substring(RGB_PREFIX.length(), lower.length() - 1));
        }
        return Optional.ofNullable(NAMED_COLORS.get(lower));
    }

    private static Optional<Color> parseHex(String digits) {
        for (int index = 0; index < digits.length(); index++) {
            if (Character.digit(digits.charAt(index), 16) < 0) {
                return Optional.empty();
            }
        }
        if (digits.length() == 3) {
            int red = Character.digit(digits.charAt(0), 16) * 17;
            int green = Character.digit(digits.charAt(1), 16) * 17;
            int blue = Character.digit(digits.charAt(2), 16) * 17;
            return Optional.of(new Color(red, green, blue));
        }
        if (digits.length() == 6) {
            return Optional.of(new Color(Integer.parseInt(digits, 16)));
        }
        return Optional.empty();
    }

    private static Optional<Color> parseRgb(String channels) {
        String[] parts = channels.split(",", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }
        int[] values = new int[3];
        for (int index = 0; index < parts.length; index++) {
            String part = parts[index].strip();
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                return Optional.empty();
            }
            values[index] = Integer.parseInt(part);
            if (values[index] > CHANNEL_MAX) {
                return Optional.empty();
            }
        }
        return Optional.of(new Color(values[0], values[1], values[2]));
    }
}
