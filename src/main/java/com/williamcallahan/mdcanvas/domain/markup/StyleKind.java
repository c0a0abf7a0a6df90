package com.williamcallahan.mdcanvas.domain.markup;

/**
 * Inline emphasis kinds recognized by the inline scanner.
 */
public enum StyleKind {
    ITALIC(true, false),
    BOLD(false, true),
    BOLD_ITALIC(true, true),
    CODE(false, false),
    STRIKETHROUGH(false, false);

    private final boolean italic;
    private final boolean bold;

    StyleKind(boolean italic, boolean bold) {
        this.italic = italic;
        this.bold = bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isBold() {
        return bold;
    }

    /**
     * Maps an emphasis marker run length to its style.
     *
     * @param markerCount number of {@code *} or {@code _} markers, 1 to 3
     * @return matching emphasis kind
     */
    public static StyleKind forMarkerCount(int markerCount) {
        return switch (markerCount) {
            case 1 -> ITALIC;
            case 2 -> BOLD;
            case 3 -> BOLD_ITALIC;
            default -> throw new IllegalArgumentException("Emphasis runs are 1 to 3 markers: " + markerCount);
        };
    }
}
