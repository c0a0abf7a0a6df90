package com.williamcallahan.mdcanvas.service.markup;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.mdcanvas.service.markup.TagExtractor.ScanMode;
import com.williamcallahan.mdcanvas.service.markup.TagExtractor.Segment;
import java.util.List;
import org.junit.jupiter.api.Test;

class TagExtractorTest {

    private final TagExtractor extractor = new TagExtractor("<md>", "</md>");

    @Test
    void extract_wellFormedRegion_splitsIntoThreeSegments() {
        List<Segment> segments = extractor.extract("ab<md>cd</md>ef");

        assertEquals(List.of(
            new Segment(0, 2, ScanMode.REDUCED),
            new Segment(6, 8, ScanMode.FULL),
            new Segment(13, 15, ScanMode.REDUCED)), segments);
    }

    @Test
    void extract_regionOnly_dropsEmptySurroundings() {
        assertEquals(List.of(new Segment(4, 6, ScanMode.FULL)), extractor.extract("<md>hi</md>"));
    }

    @Test
    void extract_delimitersOnOwnCrlfLines_dropOneBreakEach() {
        List<Segment> segments = extractor.extract("<md>\r\nx\r\n</md>\r\ny");

        assertEquals(List.of(
            new Segment(6, 7, ScanMode.FULL),
            new Segment(14, 17, ScanMode.REDUCED)), segments);
    }

    @Test
    void extract_closeDelimiterMidLine_dropsBreakAfterIt() {
        List<Segment> segments = extractor.extract("ab<md>cd</md>\nef");

        assertEquals(List.of(
            new Segment(0, 2, ScanMode.REDUCED),
            new Segment(6, 8, ScanMode.FULL),
            new Segment(14, 16, ScanMode.REDUCED)), segments);
    }

    @Test
    void extract_emptyWrappedRegion_producesNoFullSegment() {
        assertEquals(List.of(new Segment(11, 12, ScanMode.REDUCED)), extractor.extract("<md>\n</md>\nz"));
    }

    @Test
    void extract_closeBeforeOpen_fallsBackToWholeInput() {
        assertEquals(List.of(new Segment(0, 11, ScanMode.LITERAL)), extractor.extract("</md>x<md>y"));
    }

    @Test
    void extract_noRegionWithDirective_scansReduced() {
        String input = "<font:Mono>x</font>";

        assertEquals(List.of(new Segment(0, input.length(), ScanMode.REDUCED)), extractor.extract(input));
    }

    @Test
    void constructor_blankDelimiter_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TagExtractor(" ", "</md>"));
    }
}
