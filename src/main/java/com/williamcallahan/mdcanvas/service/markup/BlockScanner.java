package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.AlertType;
import com.williamcallahan.mdcanvas.domain.markup.BlockquoteSpan;
import com.williamcallahan.mdcanvas.domain.markup.HeadingSpan;
import com.williamcallahan.mdcanvas.domain.markup.StyleKind;
import java.util.Optional;

/**
 * Recognizes block constructs at the start of a line.
 *
 * <p>Recognizers run in {@link BlockKind} declaration order and the first match wins. Each one
 * either consumes its markers and returns true, or leaves the cursor where it found it. Headings
 * and list items stay open until the coordinator reaches the line break; blockquotes scan their own
 * body and close at the end of it. Fence and code lines consume their line break too, leaving the
 * context at a line start.</p>
 */
final class BlockScanner {

    private static final String FENCE = "```";
    private static final String ALERT_OPEN = "[!";
    private static final int MIN_RULE_MARKERS = 3;

    private final InlineScanner inlineScanner;

    BlockScanner(InlineScanner inlineScanner) {
        this.inlineScanner = inlineScanner;
    }

    /**
     * Strategy for one block construct.
     */
    @FunctionalInterface
    private interface BlockRecognizer {
        /**
         * Attempts the construct at the cursor.
         *
         * @param cursor positioned at a line start
         * @param context parse state
         * @return true when the construct matched and was emitted
         */
        boolean recognize(MarkupCursor cursor, ParseContext context);
    }

    /**
     * Tries every recognizer at a line start.
     *
     * @return the construct that matched, or empty to fall through to inline scanning
     */
    Optional<BlockKind> scanLineStart(MarkupCursor cursor, ParseContext context) {
        for (BlockKind kind : BlockKind.values()) {
            if (recognizerFor(kind).recognize(cursor, context)) {
                if (kind != BlockKind.BLOCKQUOTE) {
                    context.setContinuingAlert(AlertType.NORMAL);
                }
                return Optional.of(kind);
            }
        }
        context.setContinuingAlert(AlertType.NORMAL);
        return Optional.empty();
    }

    private BlockRecognizer recognizerFor(BlockKind kind) {
        return switch (kind) {
            case CODE_FENCE -> this::scanCodeFence;
            case CODE_CONTENT -> this::scanCodeContent;
            case HORIZONTAL_RULE -> this::scanHorizontalRule;
            case LIST_ITEM -> this::scanListItem;
            case HEADING -> this::scanHeading;
            case BLOCKQUOTE -> this::scanBlockquote;
        };
    }

    private boolean scanCodeFence(MarkupCursor cursor, ParseContext context) {
        String line = cursor.slice(cursor.position(), cursor.lineEnd());
        boolean fence = context.inCodeBlock() ? line.strip().equals(FENCE) : line.stripLeading().startsWith(FENCE);
        if (!fence) {
            return false;
        }
        context.setInCodeBlock(!context.inCodeBlock());
        cursor.reset(cursor.nextLineStartFrom(cursor.position()));
        context.setAtLineStart(true);
        return true;
    }

    private boolean scanCodeContent(MarkupCursor cursor, ParseContext context) {
        if (!context.inCodeBlock()) {
            return false;
        }
        int lineEnd = cursor.lineEnd();
        if (lineEnd > cursor.position()) {
            int displayStart = context.position();
            context.append(cursor.source(), cursor.position(), lineEnd);
            context.addStyle(StyleKind.CODE, displayStart, context.position());
        }
        int breakLength = cursor.lineBreakLengthAt(lineEnd);
        context.append(cursor.source(), lineEnd, lineEnd + breakLength);
        cursor.reset(lineEnd + breakLength);
        context.setAtLineStart(breakLength > 0);
        return true;
    }

    private boolean scanHorizontalRule(MarkupCursor cursor, ParseContext context) {
        int lineEnd = cursor.lineEnd();
        char marker = 0;
        int markerCount = 0;
        for (int index = cursor.position(); index < lineEnd; index++) {
            char current = cursor.charAt(index);
            if (current == ' ') {
                continue;
            }
            if (marker == 0 && (current == '-' || current == '*' || current == '_')) {
                marker = current;
            }
            if (current != marker) {
                return false;
            }
            markerCount++;
        }
        if (markerCount < MIN_RULE_MARKERS) {
            return false;
        }
        context.append(DisplayGlyphs.HORIZONTAL_RULE);
        cursor.reset(lineEnd);
        return true;
    }

    private boolean scanListItem(MarkupCursor cursor, ParseContext context) {
        int start = cursor.position();
        int spaces = 0;
        while (cursor.peek(spaces) == ' ') {
            spaces++;
        }
        char marker = cursor.peek(spaces);
        int indentLevel = spaces / context.listIndentWidth();
        if ((marker == '-' || marker == '+' || marker == '*') && cursor.peek(spaces + 1) == ' ') {
            context.append(cursor.source(), start, start + spaces);
            cursor.advance(spaces + 2);
            emitBulletItem(cursor, context, indentLevel);
            return true;
        }
        int digits = 0;
        while (Character.isDigit(cursor.peek(spaces + digits))) {
            digits++;
        }
        if (digits > 0 && cursor.peek(spaces + digits) == '.' && cursor.peek(spaces + digits + 1) == ' ') {
            context.append(cursor.source(), start, start + spaces);
            context.openListItem(indentLevel, false, true, false);
            int numberStart = start + spaces;
            int numberEnd = numberStart + digits;
            while (numberStart < numberEnd - 1 && cursor.charAt(numberStart) == '0') {
                numberStart++;
            }
            context.append(cursor.source(), numberStart, numberEnd);
            context.append(". ");
            cursor.advance(spaces + digits + 2);
            return true;
        }
        return false;
    }

    private void emitBulletItem(MarkupCursor cursor, ParseContext context, int indentLevel) {
        char box = cursor.peek(1);
        boolean taskBox = cursor.peek() == '['
            && cursor.peek(2) == ']'
            && (box == ' ' || box == 'x' || box == 'X')
            && (cursor.peek(3) == ' ' || cursor.peek(3) == MarkupCursor.END
                || cursor.lineBreakLengthAt(cursor.position() + 3) > 0);
        if (!taskBox) {
            context.openListItem(indentLevel, false, false, false);
            context.append(DisplayGlyphs.BULLET);
            return;
        }
        boolean checked = box != ' ';
        context.openListItem(indentLevel, checked, false, true);
        context.append(checked ? DisplayGlyphs.TASK_CHECKED : DisplayGlyphs.TASK_UNCHECKED);
        cursor.advance(cursor.peek(3) == ' ' ? 4 : 3);
    }

    private boolean scanHeading(MarkupCursor cursor, ParseContext context) {
        int level = 0;
        while (cursor.peek(level) == '#' && level <= HeadingSpan.MAX_LEVEL) {
            level++;
        }
        if (level < HeadingSpan.MIN_LEVEL || level > HeadingSpan.MAX_LEVEL || cursor.peek(level) != ' ') {
            return false;
        }
        cursor.advance(level + 1);
        context.openHeading(level);
        return true;
    }

    private boolean scanBlockquote(MarkupCursor cursor, ParseContext context) {
        if (cursor.peek() != '>') {
            return false;
        }
        int depth = 0;
        boolean spaceConsumed = false;
        while (cursor.peek() == '>') {
            depth++;
            cursor.advance();
            if (cursor.peek() == ' ') {
                spaceConsumed = true;
                cursor.advance();
            }
        }

        int displayStart = context.position();
        Optional<AlertType> alert = depth == 1 ? readAlertDirective(cursor) : Optional.empty();
        AlertType alertType;
        if (alert.isPresent()) {
            alertType = alert.get();
            context.append(alertType.displayPrefix());
            continueAlertBody(cursor);
        } else {
            alertType = context.continuingAlert();
            context.append(String.valueOf(DisplayGlyphs.QUOTE_BAR).repeat(depth));
            if (spaceConsumed) {
                context.append(' ');
            }
        }
        inlineScanner.scanLine(cursor, context);
        context.addBlockquote(new BlockquoteSpan(alertType, depth, displayStart, context.position()));
        context.setContinuingAlert(alertType);
        return true;
    }

    private static Optional<AlertType> readAlertDirective(MarkupCursor cursor) {
        if (!cursor.matches(ALERT_OPEN)) {
            return Optional.empty();
        }
        int nameStart = cursor.position() + ALERT_OPEN.length();
        int close = cursor.indexOf("]", nameStart, cursor.lineEnd());
        if (close < 0) {
            return Optional.empty();
        }
        Optional<AlertType> alertType = AlertType.fromDirective(cursor.slice(nameStart, close));
        alertType.ifPresent(found -> cursor.reset(close + 1));
        return alertType;
    }

    /**
     * Skips the spaces after an alert directive and, when the next line is a quote line, its line
     * break and leading marker, so the body follows the prefix on one display line.
     */
    private static void continueAlertBody(MarkupCursor cursor) {
        while (cursor.peek() == ' ') {
            cursor.advance();
        }
        int breakLength = cursor.lineBreakLengthAt(cursor.position());
        if (breakLength == 0 || cursor.peek(breakLength) != '>') {
            return;
        }
        cursor.advance(breakLength + 1);
        if (cursor.peek() == ' ') {
            cursor.advance();
        }
    }
}
