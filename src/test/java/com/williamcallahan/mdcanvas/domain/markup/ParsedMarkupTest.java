package com.williamcallahan.mdcanvas.domain.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ParsedMarkupTest {

    @Test
    void release_dropsTextAndSpans_andIsIdempotent() {
        SpanTable<LinkSpan> links = SpanTable.sizedFor(1, 10, 10);
        links.add(new LinkSpan("docs", "https://example.com", 0, 4));
        ParsedMarkup.Tables empty = ParsedMarkup.Tables.empty();
        ParsedMarkup parsed = new ParsedMarkup("docs", new ParsedMarkup.Tables(
            links, empty.headings(), empty.styles(), empty.listItems(), empty.blockquotes(),
            empty.colorTags(), empty.fontTags()));
        assertEquals(1, parsed.spanCount());

        parsed.close();
        parsed.release();

        assertTrue(parsed.isReleased());
        assertEquals("", parsed.displayText());
        assertEquals(0, parsed.spanCount());
    }
}
