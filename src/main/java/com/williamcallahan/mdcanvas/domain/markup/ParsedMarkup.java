package com.williamcallahan.mdcanvas.domain.markup;

import java.util.Objects;

/**
 * Result of one parse: the markup-free display text and the span tables that annotate it.
 *
 * <p>Every span position refers to {@link #displayText()}. The result is immutable apart from the
 * on-screen bounds of its links, which each render pass recomputes. {@link #release()} drops all
 * storage; a released result reports an empty display text and empty tables.</p>
 */
public final class ParsedMarkup implements AutoCloseable {

    private String displayText;
    private final SpanTable<LinkSpan> links;
    private final SpanTable<HeadingSpan> headings;
    private final SpanTable<StyleSpan> styles;
    private final SpanTable<ListItemSpan> listItems;
    private final SpanTable<BlockquoteSpan> blockquotes;
    private final SpanTable<ColorTagSpan> colorTags;
    private final SpanTable<FontTagSpan> fontTags;
    private boolean released;

    /**
     * Assembles a parse result from a finished parse.
     *
     * @param displayText display text with all markup removed
     * @param tables filled span tables
     */
    public ParsedMarkup(String displayText, Tables tables) {
        this.displayText = Objects.requireNonNull(displayText, "Display text cannot be null");
        Objects.requireNonNull(tables, "Span tables cannot be null");
        this.links = tables.links();
        this.headings = tables.headings();
        this.styles = tables.styles();
        this.listItems = tables.listItems();
        this.blockquotes = tables.blockquotes();
        this.colorTags = tables.colorTags();
        this.fontTags = tables.fontTags();
    }

    /**
     * Groups the seven tables so a parse result can be assembled in one call.
     */
    public record Tables(
        SpanTable<LinkSpan> links,
        SpanTable<HeadingSpan> headings,
        SpanTable<StyleSpan> styles,
        SpanTable<ListItemSpan> listItems,
        SpanTable<BlockquoteSpan> blockquotes,
        SpanTable<ColorTagSpan> colorTags,
        SpanTable<FontTagSpan> fontTags
    ) {
        public Tables {
            Objects.requireNonNull(links, "Link table cannot be null");
            Objects.requireNonNull(headings, "Heading table cannot be null");
            Objects.requireNonNull(styles, "Style table cannot be null");
            Objects.requireNonNull(listItems, "List item table cannot be null");
            Objects.requireNonNull(blockquotes, "Blockquote table cannot be null");
            Objects.requireNonNull(colorTags, "Color tag table cannot be null");
            Objects.requireNonNull(fontTags, "Font tag table cannot be null");
        }

        /**
         * Returns a set of empty tables, used for literal passthrough.
         */
        public static Tables empty() {
            return new Tables(
                SpanTable.empty(),
                SpanTable.empty(),
                SpanTable.empty(),
                SpanTable.empty(),
                SpanTable.empty(),
                SpanTable.empty(),
                SpanTable.empty());
        }
    }

    public String displayText() {
        return displayText;
    }

    public SpanTable<LinkSpan> links() {
        return links;
    }

    public SpanTable<HeadingSpan> headings() {
        return headings;
    }

    public SpanTable<StyleSpan> styles() {
        return styles;
    }

    public SpanTable<ListItemSpan> listItems() {
        return listItems;
    }

    public SpanTable<BlockquoteSpan> blockquotes() {
        return blockquotes;
    }

    public SpanTable<ColorTagSpan> colorTags() {
        return colorTags;
    }

    public SpanTable<FontTagSpan> fontTags() {
        return fontTags;
    }

    /**
     * Returns the total number of spans across all tables.
     */
    public int spanCount() {
        return links.size() + headings.size() + styles.size() + listItems.size()
            + blockquotes.size() + colorTags.size() + fontTags.size();
    }

    /**
     * Drops the display text and every span table. Calling it again has no effect.
     */
    public void release() {
        if (released) {
            return;
        }
        links.clear();
        headings.clear();
        styles.clear();
        listItems.clear();
        blockquotes.clear();
        colorTags.clear();
        fontTags.clear();
        displayText = "";
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        release();
    }
}
