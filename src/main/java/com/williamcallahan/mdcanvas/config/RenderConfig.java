package com.williamcallahan.mdcanvas.config;

import java.awt.Color;
import java.util.Locale;

/**
 * Image rendering defaults: canvas size limits, font and colors.
 */
public class RenderConfig {

    private static final String FAMILY_DEF = "SansSerif";
    private static final float FONT_SIZE_DEF = 14f;
    private static final int DEFAULT_WIDTH_DEF = 600;
    private static final int MAX_WIDTH_DEF = 4_096;
    private static final int MAX_HEIGHT_DEF = 16_384;
    private static final int PADDING_DEF = 8;
    private static final String BACKGROUND_DEF = "#FFFFFF";
    private static final String NORMAL_DEF = "#1F2328";
    private static final String LINK_DEF = "#0969DA";
    private static final String FAMILY_KEY = "app.render.font-family";
    private static final String FONT_SIZE_KEY = "app.render.base-font-size";
    private static final String DEFAULT_WIDTH_KEY = "app.render.default-width";
    private static final String MAX_WIDTH_KEY = "app.render.max-width";
    private static final String MAX_HEIGHT_KEY = "app.render.max-height";
    private static final String PADDING_KEY = "app.render.padding";
    private static final String BACKGROUND_KEY = "app.render.background-color";
    private static final String NORMAL_KEY = "app.render.normal-color";
    private static final String LINK_KEY = "app.render.link-color";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String RANGE_FMT = "%s must not exceed %s.";
    private static final String COLOR_FMT = "%s must be a hex color such as #RRGGBB: %s";

    private String fontFamily = FAMILY_DEF;
    private float baseFontSize = FONT_SIZE_DEF;
    private int defaultWidth = DEFAULT_WIDTH_DEF;
    private int maxWidth = MAX_WIDTH_DEF;
    private int maxHeight = MAX_HEIGHT_DEF;
    private int padding = PADDING_DEF;
    private String backgroundColor = BACKGROUND_DEF;
    private String normalColor = NORMAL_DEF;
    private String linkColor = LINK_DEF;

    /**
     * Validates render settings.
     */
    public void validateConfiguration() {
        if (fontFamily == null || fontFamily.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, FAMILY_KEY));
        }
        if (baseFontSize <= 0f) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, FONT_SIZE_KEY));
        }
        requirePositive(DEFAULT_WIDTH_KEY, defaultWidth);
        requirePositive(MAX_WIDTH_KEY, maxWidth);
        requirePositive(MAX_HEIGHT_KEY, maxHeight);
        if (defaultWidth > maxWidth) {
            throw new IllegalArgumentException(
                String.format(Locale.ROOT, RANGE_FMT, DEFAULT_WIDTH_KEY, MAX_WIDTH_KEY));
        }
        if (padding < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, PADDING_KEY));
        }
        decodeColor(BACKGROUND_KEY, backgroundColor);
        decodeColor(NORMAL_KEY, normalColor);
        decodeColor(LINK_KEY, linkColor);
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static Color decodeColor(String key, String value) {
        if (value == null) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, COLOR_FMT, key, null));
        }
        try {
            return Color.decode(value);
        } catch (NumberFormatException invalidColor) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, COLOR_FMT, key, value), invalidColor);
        }
    }

    public Color background() {
        return decodeColor(BACKGROUND_KEY, backgroundColor);
    }

    public Color normal() {
        return decodeColor(NORMAL_KEY, normalColor);
    }

    public Color link() {
        return decodeColor(LINK_KEY, linkColor);
    }

    public String getFontFamily() {
        return fontFamily;
    }

    public void setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
    }

    public float getBaseFontSize() {
        return baseFontSize;
    }

    public void setBaseFontSize(float baseFontSize) {
        this.baseFontSize = baseFontSize;
    }

    public int getDefaultWidth() {
        return defaultWidth;
    }

    public void setDefaultWidth(int defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public int getMaxHeight() {
        return maxHeight;
    }

    public void setMaxHeight(int maxHeight) {
        this.maxHeight = maxHeight;
    }

    public int getPadding() {
        return padding;
    }

    public void setPadding(int padding) {
        this.padding = padding;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public void setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    public String getNormalColor() {
        return normalColor;
    }

    public void setNormalColor(String normalColor) {
        this.normalColor = normalColor;
    }

    public String getLinkColor() {
        return linkColor;
    }

    public void setLinkColor(String linkColor) {
        this.linkColor = linkColor;
    }
}
