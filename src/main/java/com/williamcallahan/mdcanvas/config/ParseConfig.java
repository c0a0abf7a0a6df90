package com.williamcallahan.mdcanvas.config;

import com.williamcallahan.mdcanvas.service.markup.ParserSettings;
import java.util.Locale;

/**
 * Markup parsing limits and region delimiters.
 */
public class ParseConfig {

    private static final int MAX_INPUT_DEF = 100_000;
    private static final int MIN_POSITIVE = 1;
    private static final String MAX_INPUT_KEY = "app.parse.max-input-length";
    private static final String MAX_SPANS_KEY = "app.parse.max-spans-per-table";
    private static final String INDENT_KEY = "app.parse.list-indent-width";
    private static final String OPEN_KEY = "app.parse.region-open";
    private static final String CLOSE_KEY = "app.parse.region-close";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String BLANK_FMT = "%s must not be blank.";
    private static final String SAME_FMT = "%s and %s must differ.";

    private int maxInputLength = MAX_INPUT_DEF;
    private int maxSpansPerTable = ParserSettings.DEFAULT_MAX_SPANS_PER_TABLE;
    private int listIndentWidth = ParserSettings.DEFAULT_LIST_INDENT_WIDTH;
    private String regionOpen = ParserSettings.DEFAULT_REGION_OPEN;
    private String regionClose = ParserSettings.DEFAULT_REGION_CLOSE;

    /**
     * Validates parse settings.
     */
    public void validateConfiguration() {
        requirePositive(MAX_INPUT_KEY, maxInputLength);
        requirePositive(MAX_SPANS_KEY, maxSpansPerTable);
        requirePositive(INDENT_KEY, listIndentWidth);
        requireNotBlank(OPEN_KEY, regionOpen);
        requireNotBlank(CLOSE_KEY, regionClose);
        if (regionOpen.equals(regionClose)) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, SAME_FMT, OPEN_KEY, CLOSE_KEY));
        }
    }

    /**
     * Builds parser settings from these properties.
     *
     * @return parser settings
     */
    public ParserSettings toParserSettings() {
        return new ParserSettings(regionOpen, regionClose, listIndentWidth, maxSpansPerTable);
    }

    private static void requirePositive(String key, int value) {
        if (value < MIN_POSITIVE) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static void requireNotBlank(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, BLANK_FMT, key));
        }
    }

    public int getMaxInputLength() {
        return maxInputLength;
    }

    public void setMaxInputLength(int maxInputLength) {
        this.maxInputLength = maxInputLength;
    }

    public int getMaxSpansPerTable() {
        return maxSpansPerTable;
    }

    public void setMaxSpansPerTable(int maxSpansPerTable) {
        this.maxSpansPerTable = maxSpansPerTable;
    }

    public int getListIndentWidth() {
        return listIndentWidth;
    }

    public void setListIndentWidth(int listIndentWidth) {
        this.listIndentWidth = listIndentWidth;
    }

    public String getRegionOpen() {
        return regionOpen;
    }

    public void setRegionOpen(String regionOpen) {
        this.regionOpen = regionOpen;
    }

    public String getRegionClose() {
        return regionClose;
    }

    public void setRegionClose(String regionClose) {
        this.regionClose = regionClose;
    }
}
