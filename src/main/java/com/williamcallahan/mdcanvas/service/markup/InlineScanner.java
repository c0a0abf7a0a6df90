package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.LinkSpan;
import com.williamcallahan.mdcanvas.domain.markup.StyleKind;
import com.williamcallahan.mdcanvas.domain.markup.StyleSpan;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recognizes inline markup: links, images, emphasis, strikethrough, inline code, escapes and directives.
 *
 * <p>Every search for a closing marker stops at the end of the current line. A failed match leaves
 * the cursor untouched so the coordinator copies the opening character literally and resumes one
 * character later.</p>
 */
final class InlineScanner {

    static final String ESCAPABLE = "\\`*_{}[]()#+-.!<>~|";

    private static final int MAX_EMPHASIS_RUN = 3;

    private final DirectiveTagScanner directiveScanner;

    InlineScanner(DirectiveTagScanner directiveScanner) {
        this.directiveScanner = directiveScanner;
    }

    /**
     * Attempts one inline element at the cursor.
     *
     * @return true when markup was consumed and its text emitted
     */
    boolean scan(MarkupCursor cursor, ParseContext context) {
        return switch (cursor.peek()) {
            case '[' -> scanLink(cursor, context);
            case '!' -> skipImage(cursor);
            case '`' -> scanCode(cursor, context);
            case '*', '_' -> scanEmphasis(cursor, context);
            case '~' -> scanStrikethrough(cursor, context);
            case '<' -> directiveScanner.scan(cursor, context, DirectiveTagScanner.Mode.FULL, this::scanLine);
            default -> false;
        };
    }

    /**
     * Copies an escaped punctuation character without its backslash.
     */
    boolean scanEscape(MarkupCursor cursor, ParseContext context) {
        if (cursor.peek() != '\\') {
            return false;
        }
        char escaped = cursor.peek(1);
        if (escaped == MarkupCursor.END || ESCAPABLE.indexOf(escaped) < 0) {
            return false;
        }
        context.append(escaped);
        cursor.advance(2);
        return true;
    }

    /**
     * Scans inline markup up to the next line break or the end of the cursor range.
     */
    void scanLine(MarkupCursor cursor, ParseContext context) {
        while (!cursor.atEnd() && !cursor.atLineBreak()) {
            if (scan(cursor, context) || scanEscape(cursor, context)) {
                continue;
            }
            context.append(cursor.peek());
            cursor.advance();
        }
    }

    /**
     * Consumes {@code ![size](path)}. Images occupy no display text and are not loaded.
     */
    private static boolean skipImage(MarkupCursor cursor) {
        if (cursor.peek(1) != '[') {
            return false;
        }
        int start = cursor.position();
        int lineEnd = cursor.lineEnd();
        int sizeEnd = cursor.indexOf("]", start + 2, lineEnd);
        if (sizeEnd < 0 || cursor.charAt(sizeEnd + 1) != '(') {
            return false;
        }
        int pathStart = sizeEnd + 2;
        int pathEnd = cursor.indexOf(")", pathStart, lineEnd);
        if (pathEnd <= pathStart) {
            return false;
        }
        cursor.reset(pathEnd + 1);
        return true;
    }

    private boolean scanLink(MarkupCursor cursor, ParseContext context) {
        int start = cursor.position();
        int lineEnd = cursor.lineEnd();
        int textEnd = cursor.indexOf("]", start + 1, lineEnd);
        if (textEnd < 0 || cursor.charAt(textEnd + 1) != '(') {
            return false;
        }
        int urlStart = textEnd + 2;
        int urlEnd = findLinkClose(cursor, urlStart, lineEnd);
        if (urlEnd < 0) {
            return false;
        }
        int actualUrlEnd = urlStart;
        while (actualUrlEnd < urlEnd) {
            char current = cursor.charAt(actualUrlEnd);
            if (current == ' ' || current == '"' || current == '\'') {
                break;
            }
            actualUrlEnd++;
        }

        int displayStart = context.position();
        List<StyleSpan> linkStyles = new ArrayList<>();
        String cleanText = stripEmphasis(cursor.slice(start + 1, textEnd), displayStart, linkStyles);
        String url = cursor.slice(urlStart, actualUrlEnd);

        context.append(cleanText);
        if (!url.isEmpty()) {
            context.addLink(new LinkSpan(cleanText, url, displayStart, displayStart + cleanText.length()));
        }
        linkStyles.sort(Comparator.comparingInt(StyleSpan::startPos));
        for (StyleSpan style : linkStyles) {
            context.addStyle(style.kind(), style.startPos(), style.endPos());
        }
        cursor.reset(urlEnd + 1);
        return true;
    }

    private static int findLinkClose(MarkupCursor cursor, int from, int lineEnd) {
        int index = from;
        while (index < lineEnd) {
            char current = cursor.charAt(index);
            if (current == ')') {
                return index;
            }
            if (current == '"' || current == '\'') {
                index++;
                while (index < lineEnd && cursor.charAt(index) != current) {
                    index++;
                }
            }
            index++;
        }
        return -1;
    }

    /**
     * Removes emphasis and strikethrough markers from link text, recording the styles they delimit.
     * Unpaired markers are dropped.
     */
    private static String stripEmphasis(String rawText, int basePos, List<StyleSpan> styles) {
        StringBuilder clean = new StringBuilder(rawText.length());
        int boldItalicStart = -1;
        int boldStart = -1;
        int italicStart = -1;
        int strikeStart = -1;
        int index = 0;
        while (index < rawText.length()) {
            char current = rawText.charAt(index);
            if ((current == '*' || current == '_') && rawText.startsWith(repeat(current, 3), index)) {
                boldItalicStart = toggle(boldItalicStart, StyleKind.BOLD_ITALIC, clean.length(), basePos, styles);
                index += 3;
            } else if ((current == '*' || current == '_') && rawText.startsWith(repeat(current, 2), index)) {
                boldStart = toggle(boldStart, StyleKind.BOLD, clean.length(), basePos, styles);
                index += 2;
            } else if (current == '~' && rawText.startsWith("~~", index)) {
                strikeStart = toggle(strikeStart, StyleKind.STRIKETHROUGH, clean.length(), basePos, styles);
                index += 2;
            } else if (current == '*' || current == '_') {
                italicStart = toggle(italicStart, StyleKind.ITALIC, clean.length(), basePos, styles);
                index++;
            } else {
                clean.append(current);
                index++;
            }
        }
        return clean.toString();
    }

    private static int toggle(int openAt, StyleKind kind, int cleanPos, int basePos, List<StyleSpan> styles) {
        if (openAt < 0) {
            return cleanPos;
        }
        styles.add(new StyleSpan(kind, basePos + openAt, basePos + cleanPos));
        return -1;
    }

    private static String repeat(char marker, int count) {
        return String.valueOf(marker).repeat(count);
    }

    private boolean scanEmphasis(MarkupCursor cursor, ParseContext context) {
        char marker = cursor.peek();
        int start = cursor.position();
        int markerCount = 0;
        while (cursor.peek(markerCount) == marker && markerCount < MAX_EMPHASIS_RUN) {
            markerCount++;
        }
        int textStart = start + markerCount;
        char afterOpener = cursor.charAt(textStart);
        if (afterOpener == ' ' || afterOpener == MarkupCursor.END || cursor.lineBreakLengthAt(textStart) > 0) {
            return false;
        }
        int lineEnd = cursor.lineEnd();
        for (int end = textStart; end < lineEnd; end++) {
            if (cursor.charAt(end) != marker) {
                continue;
            }
            int closeCount = 0;
            while (closeCount < markerCount && end + closeCount < lineEnd && cursor.charAt(end + closeCount) == marker) {
                closeCount++;
            }
            if (closeCount == markerCount && end > textStart) {
                emitStyled(cursor, context, StyleKind.forMarkerCount(markerCount), textStart, end);
                cursor.reset(end + markerCount);
                return true;
            }
        }
        return false;
    }

    private boolean scanCode(MarkupCursor cursor, ParseContext context) {
        int textStart = cursor.position() + 1;
        int end = cursor.indexOf("`", textStart, cursor.lineEnd());
        if (end <= textStart) {
            return false;
        }
        emitStyled(cursor, context, StyleKind.CODE, textStart, end);
        cursor.reset(end + 1);
        return true;
    }

    private boolean scanStrikethrough(MarkupCursor cursor, ParseContext context) {
        if (!cursor.matches("~~")) {
            return false;
        }
        int textStart = cursor.position() + 2;
        int end = cursor.indexOf("~~", textStart, cursor.lineEnd());
        if (end <= textStart) {
            return false;
        }
        emitStyled(cursor, context, StyleKind.STRIKETHROUGH, textStart, end);
        cursor.reset(end + 2);
        return true;
    }

    private static void emitStyled(MarkupCursor cursor, ParseContext context, StyleKind kind, int from, int to) {
        int displayStart = context.position();
        context.append(cursor.source(), from, to);
        context.addStyle(kind, displayStart, context.position());
    }
}
