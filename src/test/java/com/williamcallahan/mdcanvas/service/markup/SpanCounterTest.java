package com.williamcallahan.mdcanvas.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.mdcanvas.domain.markup.SpanKind;
import org.junit.jupiter.api.Test;

class SpanCounterTest {

    @Test
    void count_blockLines_areCountedOncePerLine() {
        CapacityPlan plan = SpanCounter.count("# One\n## Two\n- a\n1. b\n> q\nplain");

        assertEquals(2, plan.countOf(SpanKind.HEADING));
        assertEquals(2, plan.countOf(SpanKind.LIST_ITEM));
        assertEquals(1, plan.countOf(SpanKind.BLOCKQUOTE));
    }

    @Test
    void count_fencedLines_countAsCodeStylesOnly() {
        CapacityPlan plan = SpanCounter.count("```\n# not heading\n[x](y)\n```");

        assertEquals(0, plan.countOf(SpanKind.HEADING));
        assertEquals(0, plan.countOf(SpanKind.LINK));
        assertEquals(2, plan.countOf(SpanKind.STYLE));
    }

    @Test
    void count_inlineMarkers_estimateStylesLinksAndDirectives() {
        CapacityPlan plan = SpanCounter.count("**a** `b` [c](d) <color:red>e</color> <font:Serif>f</font>");

        assertEquals(1, plan.countOf(SpanKind.LINK));
        assertEquals(1, plan.countOf(SpanKind.COLOR_TAG));
        assertEquals(1, plan.countOf(SpanKind.FONT_TAG));
        assertEquals(3, plan.countOf(SpanKind.STYLE));
    }

    @Test
    void plus_sumsPerKind() {
        CapacityPlan combined = SpanCounter.count("[a](b)").plus(SpanCounter.count("[c](d)\n# e"));

        assertEquals(2, combined.countOf(SpanKind.LINK));
        assertEquals(1, combined.countOf(SpanKind.HEADING));
    }
}
