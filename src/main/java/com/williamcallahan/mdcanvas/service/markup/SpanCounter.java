package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.SpanKind;

/**
 * Estimates how many spans of each kind a text will produce, in a single pass.
 *
 * <p>The estimate only sizes the tables; a low count costs a table doubling, never a wrong parse.
 * Line-start patterns mirror the block recognizers, inline patterns count marker pairs.</p>
 */
final class SpanCounter {

    private static final String COLOR_OPEN = "<color:";
    private static final String FONT_OPEN = "<font:";
    private static final String CODE_FENCE = "```";

    private SpanCounter() {}

    static CapacityPlan count(String text) {
        if (text == null || text.isEmpty()) {
            return CapacityPlan.none();
        }
        int links = 0;
        int headings = 0;
        int listItems = 0;
        int blockquotes = 0;
        int colorTags = 0;
        int fontTags = 0;
        int backticks = 0;
        int emphasisRuns = 0;
        int tildePairs = 0;
        int codeLines = 0;
        boolean inFence = false;

        int length = text.length();
        int index = 0;
        while (index < length) {
            int lineEnd = lineEnd(text, index);
            String line = text.substring(index, lineEnd);
            String trimmed = line.strip();
            if (trimmed.startsWith(CODE_FENCE)) {
                inFence = !inFence;
            } else if (inFence) {
                codeLines++;
            } else {
                headings += isHeadingLine(line) ? 1 : 0;
                listItems += isListLine(line) ? 1 : 0;
                blockquotes += line.startsWith(">") ? 1 : 0;
                for (int scan = 0; scan < line.length(); scan++) {
                    char current = line.charAt(scan);
                    if (current == '`') {
                        backticks++;
                    } else if (current == '*' || current == '_') {
                        if (scan == 0 || line.charAt(scan - 1) != current) {
                            emphasisRuns++;
                        }
                    } else if (current == '~' && line.startsWith("~~", scan)) {
                        tildePairs++;
                        scan++;
                    } else if (current == ']' && line.startsWith("](", scan)) {
                        links++;
                    } else if (current == '<') {
                        colorTags += line.startsWith(COLOR_OPEN, scan) ? 1 : 0;
                        fontTags += line.startsWith(FONT_OPEN, scan) ? 1 : 0;
                    }
                }
            }
            index = lineEnd < length ? lineEnd + 1 : length;
        }

        int styles = backticks / 2 + emphasisRuns / 2 + tildePairs / 2 + codeLines + links;
        return CapacityPlan.none()
            .with(SpanKind.LINK, links)
            .with(SpanKind.HEADING, headings)
            .with(SpanKind.STYLE, styles)
            .with(SpanKind.LIST_ITEM, listItems)
            .with(SpanKind.BLOCKQUOTE, blockquotes)
            .with(SpanKind.COLOR_TAG, colorTags)
            .with(SpanKind.FONT_TAG, fontTags);
    }

    private static int lineEnd(String text, int from) {
        for (int scan = from; scan < text.length(); scan++) {
            char current = text.charAt(scan);
            if (current == '\n' || current == '\r') {
                return scan;
            }
        }
        return text.length();
    }

    private static boolean isHeadingLine(String line) {
        int hashes = 0;
        while (hashes < line.length() && line.charAt(hashes) == '#') {
            hashes++;
        }
        return hashes >= 1 && hashes <= 6 && hashes < line.length() && line.charAt(hashes) == ' ';
    }

    private static boolean isListLine(String line) {
        int scan = 0;
        while (scan < line.length() && line.charAt(scan) == ' ') {
            scan++;
        }
        if (scan + 1 < line.length()) {
            char marker = line.charAt(scan);
            if ((marker == '-' || marker == '+' || marker == '*') && line.charAt(scan + 1) == ' ') {
                return true;
            }
        }
        int digitsEnd = scan;
        while (digitsEnd < line.length() && Character.isDigit(line.charAt(digitsEnd))) {
            digitsEnd++;
        }
        return digitsEnd > scan && line.startsWith(". ", digitsEnd);
    }
}
