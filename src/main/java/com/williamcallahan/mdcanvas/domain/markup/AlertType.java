package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Optional;

/**
 * Blockquote categories selected by a {@code [!TYPE]} directive on the first quote line.
 */
public enum AlertType {
    NORMAL("", ""),
    NOTE("NOTE", "NOTE: "),
    TIP("TIP", "TIP: "),
    IMPORTANT("IMPORTANT", "IMPORTANT: "),
    WARNING("WARNING", "WARNING: "),
    CAUTION("CAUTION", "CAUTION: ");

    private final String directiveName;
    private final String displayPrefix;

    AlertType(String directiveName, String displayPrefix) {
        this.directiveName = directiveName;
        this.displayPrefix = displayPrefix;
    }

    /**
     * Returns the name written inside {@code [!...]}.
     */
    public String directiveName() {
        return directiveName;
    }

    /**
     * Returns the text substituted for the directive in the display text.
     */
    public String displayPrefix() {
        return displayPrefix;
    }

    /**
     * Looks up an alert by its exact, case-sensitive directive name.
     *
     * @param name text between {@code [!} and {@code ]}
     * @return alert type, or empty when the name is not one of the five alerts
     */
    public static Optional<AlertType> fromDirective(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        for (AlertType type : values()) {
            if (type != NORMAL && type.directiveName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
