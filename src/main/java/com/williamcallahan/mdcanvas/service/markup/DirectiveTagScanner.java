package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.ColorTagSpan;
import com.williamcallahan.mdcanvas.domain.markup.FontTagSpan;
import java.awt.Color;
import java.util.List;
import java.util.Optional;

/**
 * Recognizes {@code <color:VALUE>...</color>} and {@code <font:NAME>...</font>} directives.
 *
 * <p>Directives are the only markup honored outside a markup region. There the closing tag may sit
 * on a later line and the enclosed text stays literal apart from nested directives. Inside a region
 * the closing tag must be on the same line and the enclosed text goes through the inline scanner.
 * Closing tags are matched by nesting depth, so {@code <color:red>a <color:blue>b</color></color>}
 * closes the outer tag at the second {@code </color>}.</p>
 */
final class DirectiveTagScanner {

    private static final char TAG_END = '>';

    /**
     * Directive tag pairs.
     */
    enum DirectiveKind {
        COLOR("<color:", "</color>"),
        FONT("<font:", "</font>");

        private final String openPrefix;
        private final String closeTag;

        DirectiveKind(String openPrefix, String closeTag) {
            this.openPrefix = openPrefix;
            this.closeTag = closeTag;
        }

        String openPrefix() {
            return openPrefix;
        }

        String closeTag() {
            return closeTag;
        }
    }

    /**
     * Where a directive sits, which decides how far its closing tag may be and how its text is scanned.
     */
    enum Mode {
        REDUCED,
        FULL
    }

    /**
     * Scans the text enclosed by a directive.
     */
    @FunctionalInterface
    interface InnerTextScanner {
        void scanInner(MarkupCursor inner, ParseContext context);
    }

    /**
     * Checks whether any directive opening appears in a text.
     *
     * @param text raw input
     * @return true when a color or font tag opening is present
     */
    static boolean containsDirective(String text) {
        for (DirectiveKind kind : DirectiveKind.values()) {
            if (text.contains(kind.openPrefix())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copies a range literally while honoring directives, the scanning mode used outside regions.
     *
     * @param cursor range to scan, consumed entirely
     * @param context parse state receiving text and spans
     */
    void scanReduced(MarkupCursor cursor, ParseContext context) {
        while (!cursor.atEnd()) {
            if (cursor.peek() == '<' && scan(cursor, context, Mode.REDUCED, this::scanReduced)) {
                continue;
            }
            context.append(cursor.peek());
            cursor.advance();
        }
    }

    /**
     * Attempts a directive at the cursor.
     *
     * @param cursor positioned at {@code <}
     * @param context parse state receiving text and spans
     * @param mode scanning mode
     * @param innerScanner scanner for the enclosed text
     * @return true when a complete directive was consumed; the cursor is unchanged otherwise
     */
    boolean scan(MarkupCursor cursor, ParseContext context, Mode mode, InnerTextScanner innerScanner) {
        Optional<DirectiveKind> detected = detectKind(cursor);
        if (detected.isEmpty()) {
            return false;
        }
        DirectiveKind kind = detected.get();
        int start = cursor.position();
        int lineEnd = cursor.lineEnd();
        int valueStart = start + kind.openPrefix().length();
        int tagEnd = cursor.indexOf(String.valueOf(TAG_END), valueStart, lineEnd);
        if (tagEnd < 0) {
            return false;
        }
        String value = cursor.slice(valueStart, tagEnd);
        if (value.indexOf('<') >= 0) {
            return false;
        }
        int innerStart = tagEnd + 1;
        int searchLimit = mode == Mode.FULL ? lineEnd : cursor.limit();
        int closeAt = findClosingTag(cursor, kind, innerStart, searchLimit);
        if (closeAt < 0) {
            return false;
        }
        boolean emitted = switch (kind) {
            case COLOR -> emitColor(cursor, context, value, innerStart, closeAt, innerScanner);
            case FONT -> emitFont(cursor, context, value, innerStart, closeAt, innerScanner);
        };
        if (!emitted) {
            return false;
        }
        cursor.reset(closeAt + kind.closeTag().length());
        return true;
    }

    private Optional<DirectiveKind> detectKind(MarkupCursor cursor) {
        for (DirectiveKind kind : DirectiveKind.values()) {
            if (cursor.matches(kind.openPrefix())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private boolean emitColor(
            MarkupCursor cursor,
            ParseContext context,
            String value,
            int innerStart,
            int closeAt,
            InnerTextScanner innerScanner) {
        Optional<List<Color>> colors = ColorValueParser.parse(value);
        if (colors.isEmpty()) {
            return false;
        }
        int displayStart = context.position();
        int index = context.openColorTag(new ColorTagSpan(displayStart, displayStart, value, colors.get()));
        innerScanner.scanInner(cursor.subRange(innerStart, closeAt), context);
        context.closeColorTag(index, new ColorTagSpan(displayStart, context.position(), value, colors.get()));
        return true;
    }

    private boolean emitFont(
            MarkupCursor cursor,
            ParseContext context,
            String value,
            int innerStart,
            int closeAt,
            InnerTextScanner innerScanner) {
        String fontName = value.strip();
        if (fontName.isEmpty() || fontName.length() > FontTagSpan.MAX_FONT_NAME_LENGTH) {
            return false;
        }
        int displayStart = context.position();
        int index = context.openFontTag(new FontTagSpan(displayStart, displayStart, fontName));
        innerScanner.scanInner(cursor.subRange(innerStart, closeAt), context);
        context.closeFontTag(index, new FontTagSpan(displayStart, context.position(), fontName));
        return true;
    }

    private static int findClosingTag(MarkupCursor cursor, DirectiveKind kind, int from, int limit) {
        int depth = 1;
        int index = from;
        while (index < limit) {
            if (cursor.matchesAt(index, kind.closeTag()) && index + kind.closeTag().length() <= limit) {
                depth--;
                if (depth == 0) {
                    return index;
                }
                index += kind.closeTag().length();
            } else if (cursor.matchesAt(index, kind.openPrefix())) {
                depth++;
                index += kind.openPrefix().length();
            } else {
                index++;
            }
        }
        return -1;
    }
}
