package com.williamcallahan.mdcanvas.service.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits raw input around the markup region delimiters.
 *
 * <p>Only text between the first opening delimiter and the first closing delimiter gets full
 * parsing. Text around a well-formed region, or the whole input when the delimiters are missing or
 * out of order, keeps only its color and font directives. Input with neither is passed through
 * untouched. The delimiters take their own lines with them: one line break directly after the
 * opening delimiter is dropped, and the closing delimiter drops the line break before it, or the one
 * after it when it does not start a line.</p>
 */
final class TagExtractor {

    /**
     * How a segment of the input is scanned.
     */
    enum ScanMode {
        LITERAL,
        REDUCED,
        FULL
    }

    /**
     * A half-open range of the input and the mode it is scanned in.
     */
    record Segment(int start, int end, ScanMode mode) {
        Segment {
            Objects.requireNonNull(mode, "Scan mode cannot be null");
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid segment [" + start + ", " + end + ")");
            }
        }

        boolean isEmpty() {
            return start == end;
        }
    }

    private final String regionOpen;
    private final String regionClose;

    TagExtractor(String regionOpen, String regionClose) {
        this.regionOpen = requireDelimiter(regionOpen, "Region open delimiter");
        this.regionClose = requireDelimiter(regionClose, "Region close delimiter");
    }

    private static String requireDelimiter(String delimiter, String label) {
        Objects.requireNonNull(delimiter, label + " cannot be null");
        if (delimiter.isBlank()) {
            throw new IllegalArgumentException(label + " cannot be blank");
        }
        return delimiter;
    }

    /**
     * Plans how each part of the input is scanned.
     *
     * @param input raw text
     * @return non-empty segments in input order, covering everything except delimiters and trimmed breaks
     */
    List<Segment> extract(String input) {
        int openAt = input.indexOf(regionOpen);
        int closeAt = input.indexOf(regionClose);
        if (openAt >= 0 && closeAt >= openAt + regionOpen.length()) {
            int regionStart = Math.min(skipLineBreak(input, openAt + regionOpen.length()), closeAt);
            int regionEnd = Math.max(regionStart, closeAt - lineBreakBefore(input, closeAt));
            int afterClose = closeAt + regionClose.length();
            int afterStart = regionEnd < closeAt ? afterClose : skipLineBreak(input, afterClose);
            List<Segment> segments = new ArrayList<>(3);
            addIfNotEmpty(segments, new Segment(0, openAt, ScanMode.REDUCED));
            addIfNotEmpty(segments, new Segment(regionStart, regionEnd, ScanMode.FULL));
            addIfNotEmpty(segments, new Segment(afterStart, input.length(), ScanMode.REDUCED));
            return segments;
        }
        ScanMode wholeInput = DirectiveTagScanner.containsDirective(input) ? ScanMode.REDUCED : ScanMode.LITERAL;
        return List.of(new Segment(0, input.length(), wholeInput));
    }

    private static void addIfNotEmpty(List<Segment> segments, Segment segment) {
        if (!segment.isEmpty()) {
            segments.add(segment);
        }
    }

    private static int lineBreakBefore(String input, int index) {
        if (index >= 2 && input.startsWith("\r\n", index - 2)) {
            return 2;
        }
        if (index >= 1 && (input.charAt(index - 1) == '\n' || input.charAt(index - 1) == '\r')) {
            return 1;
        }
        return 0;
    }

    private static int skipLineBreak(String input, int index) {
        if (input.startsWith("\r\n", index)) {
            return index + 2;
        }
        if (index < input.length() && (input.charAt(index) == '\n' || input.charAt(index) == '\r')) {
            return index + 1;
        }
        return index;
    }
}
