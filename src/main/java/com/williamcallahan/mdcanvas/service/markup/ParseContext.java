package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.AlertType;
import com.williamcallahan.mdcanvas.domain.markup.BlockquoteSpan;
import com.williamcallahan.mdcanvas.domain.markup.ColorTagSpan;
import com.williamcallahan.mdcanvas.domain.markup.FontTagSpan;
import com.williamcallahan.mdcanvas.domain.markup.HeadingSpan;
import com.williamcallahan.mdcanvas.domain.markup.LinkSpan;
import com.williamcallahan.mdcanvas.domain.markup.ListItemSpan;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import com.williamcallahan.mdcanvas.domain.markup.SpanKind;
import com.williamcallahan.mdcanvas.domain.markup.SpanTable;
import com.williamcallahan.mdcanvas.domain.markup.StyleKind;
import com.williamcallahan.mdcanvas.domain.markup.StyleSpan;

/**
 * Mutable state of one parse, owned by a single parse call and passed to every recognizer.
 *
 * <p>Holds the display buffer, the span tables being filled, and the line-level state of the
 * coordinator. Display positions are the buffer length at the time a span opens or closes.</p>
 */
final class ParseContext {

    private static final int NO_OPEN_SPAN = -1;

    private final StringBuilder display;
    private final SpanTable<LinkSpan> links;
    private final SpanTable<HeadingSpan> headings;
    private final SpanTable<StyleSpan> styles;
    private final SpanTable<ListItemSpan> listItems;
    private final SpanTable<BlockquoteSpan> blockquotes;
    private final SpanTable<ColorTagSpan> colorTags;
    private final SpanTable<FontTagSpan> fontTags;
    private final int listIndentWidth;

    private boolean atLineStart = true;
    private boolean inCodeBlock;
    private int openListItem = NO_OPEN_SPAN;
    private int openHeading = NO_OPEN_SPAN;
    private AlertType continuingAlert = AlertType.NORMAL;

    ParseContext(int expectedLength, CapacityPlan plan, int maxSpansPerTable, int listIndentWidth) {
        this.display = new StringBuilder(Math.max(16, expectedLength));
        this.links = plan.allocate(SpanKind.LINK, maxSpansPerTable);
        this.headings = plan.allocate(SpanKind.HEADING, maxSpansPerTable);
        this.styles = plan.allocate(SpanKind.STYLE, maxSpansPerTable);
        this.listItems = plan.allocate(SpanKind.LIST_ITEM, maxSpansPerTable);
        this.blockquotes = plan.allocate(SpanKind.BLOCKQUOTE, maxSpansPerTable);
        this.colorTags = plan.allocate(SpanKind.COLOR_TAG, maxSpansPerTable);
        this.fontTags = plan.allocate(SpanKind.FONT_TAG, maxSpansPerTable);
        this.listIndentWidth = listIndentWidth;
    }

    int position() {
        return display.length();
    }

    void append(char literal) {
        display.append(literal);
    }

    void append(CharSequence literal) {
        display.append(literal);
    }

    void append(String source, int from, int to) {
        display.append(source, from, to);
    }

    boolean atLineStart() {
        return atLineStart;
    }

    void setAtLineStart(boolean atLineStart) {
        this.atLineStart = atLineStart;
    }

    boolean inCodeBlock() {
        return inCodeBlock;
    }

    void setInCodeBlock(boolean inCodeBlock) {
        this.inCodeBlock = inCodeBlock;
    }

    AlertType continuingAlert() {
        return continuingAlert;
    }

    void setContinuingAlert(AlertType alertType) {
        this.continuingAlert = alertType;
    }

    int listIndentWidth() {
        return listIndentWidth;
    }

    void addLink(LinkSpan link) {
        links.add(link);
    }

    void addStyle(StyleKind kind, int startPos, int endPos) {
        styles.add(new StyleSpan(kind, startPos, endPos));
    }

    void addBlockquote(BlockquoteSpan blockquote) {
        blockquotes.add(blockquote);
    }

    /**
     * Reserves a color tag slot before its inner text is scanned so nested tags keep start order.
     *
     * @return index to pass to {@link #closeColorTag}
     */
    int openColorTag(ColorTagSpan placeholder) {
        return colorTags.add(placeholder);
    }

    void closeColorTag(int index, ColorTagSpan closed) {
        colorTags.replace(index, closed);
    }

    int openFontTag(FontTagSpan placeholder) {
        return fontTags.add(placeholder);
    }

    void closeFontTag(int index, FontTagSpan closed) {
        fontTags.replace(index, closed);
    }

    void openHeading(int level) {
        closeLineSpans();
        openHeading = headings.add(new HeadingSpan(level, position(), position()));
    }

    void openListItem(int indentLevel, boolean checked, boolean ordered, boolean taskItem) {
        closeLineSpans();
        openListItem = listItems.add(new ListItemSpan(position(), position(), indentLevel, checked, ordered, taskItem));
    }

    /**
     * Closes any open heading or list item at the current position.
     */
    void closeLineSpans() {
        int closingPos = position();
        if (openHeading != NO_OPEN_SPAN) {
            headings.replace(openHeading, headings.get(openHeading).closedAt(closingPos));
            openHeading = NO_OPEN_SPAN;
        }
        if (openListItem != NO_OPEN_SPAN) {
            listItems.replace(openListItem, listItems.get(openListItem).closedAt(closingPos));
            openListItem = NO_OPEN_SPAN;
        }
    }

    /**
     * Closes open spans and hands the buffer and tables to an immutable result.
     */
    ParsedMarkup finish() {
        closeLineSpans();
        return new ParsedMarkup(
            display.toString(),
            new ParsedMarkup.Tables(links, headings, styles, listItems, blockquotes, colorTags, fontTags));
    }
}
