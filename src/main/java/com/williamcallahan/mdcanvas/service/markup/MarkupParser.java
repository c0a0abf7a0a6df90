package com.williamcallahan.mdcanvas.service.markup;

import com.williamcallahan.mdcanvas.domain.markup.AlertType;
import com.williamcallahan.mdcanvas.domain.markup.MarkupAllocationException;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns marked-up text into display text plus span tables.
 *
 * <p>{@link #parse(String)} honors the markup region: full parsing applies only between the region
 * delimiters, and the surrounding text keeps just its color and font directives.
 * {@link #parseRegion(String)} treats the whole input as one region.</p>
 *
 * <p>Each call owns its parse state, so one parser can serve concurrent callers. A call that cannot
 * grow a span table abandons everything it built and returns an empty result.</p>
 */
public class MarkupParser {

    private static final Logger log = LoggerFactory.getLogger(MarkupParser.class);

    private final ParserSettings settings;
    private final TagExtractor tagExtractor;
    private final DirectiveTagScanner directiveScanner;
    private final InlineScanner inlineScanner;
    private final BlockScanner blockScanner;

    /**
     * Creates a parser with default delimiters and limits.
     */
    public MarkupParser() {
        this(ParserSettings.defaults());
    }

    /**
     * Creates a parser with explicit settings.
     *
     * @param settings delimiters and limits
     */
    public MarkupParser(ParserSettings settings) {
        this.settings = Objects.requireNonNull(settings, "Parser settings cannot be null");
        this.tagExtractor = new TagExtractor(settings.regionOpen(), settings.regionClose());
        this.directiveScanner = new DirectiveTagScanner();
        this.inlineScanner = new InlineScanner(directiveScanner);
        this.blockScanner = new BlockScanner(inlineScanner);
    }

    public ParserSettings settings() {
        return settings;
    }

    /**
     * Parses raw input, applying full markup only inside the markup region.
     *
     * @param input raw text, possibly containing region delimiters and directives
     * @return parse result, or empty for null or empty input and on allocation failure
     */
    public Optional<ParsedMarkup> parse(String input) {
        if (input == null || input.isEmpty()) {
            return Optional.empty();
        }
        List<TagExtractor.Segment> segments = tagExtractor.extract(input);
        if (segments.size() == 1 && segments.get(0).mode() == TagExtractor.ScanMode.LITERAL) {
            return Optional.of(new ParsedMarkup(input, ParsedMarkup.Tables.empty()));
        }
        return runParse(input, segments);
    }

    /**
     * Parses the whole input as markup, without looking for region delimiters.
     *
     * @param markup marked-up text
     * @return parse result, or empty for null or empty input and on allocation failure
     */
    public Optional<ParsedMarkup> parseRegion(String markup) {
        if (markup == null || markup.isEmpty()) {
            return Optional.empty();
        }
        return runParse(markup, List.of(new TagExtractor.Segment(0, markup.length(), TagExtractor.ScanMode.FULL)));
    }

    private Optional<ParsedMarkup> runParse(String input, List<TagExtractor.Segment> segments) {
        try {
            CapacityPlan plan = CapacityPlan.none();
            for (TagExtractor.Segment segment : segments) {
                plan = plan.plus(SpanCounter.count(input.substring(segment.start(), segment.end())));
            }
            ParseContext context = new ParseContext(
                input.length(), plan, settings.maxSpansPerTable(), settings.listIndentWidth());
            MarkupCursor cursor = new MarkupCursor(input);
            for (TagExtractor.Segment segment : segments) {
                MarkupCursor segmentCursor = cursor.subRange(segment.start(), segment.end());
                switch (segment.mode()) {
                    case FULL -> scanRegion(segmentCursor, context);
                    case REDUCED -> directiveScanner.scanReduced(segmentCursor, context);
                    case LITERAL -> context.append(input, segment.start(), segment.end());
                }
            }
            ParsedMarkup parsed = context.finish();
            log.debug("Parsed {} input chars into {} display chars and {} spans",
                input.length(), parsed.displayText().length(), parsed.spanCount());
            return Optional.of(parsed);
        } catch (MarkupAllocationException allocationFailure) {
            log.warn("Abandoning parse of {} chars: {}", input.length(), allocationFailure.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Runs the block and inline recognizers over one markup region.
     */
    private void scanRegion(MarkupCursor cursor, ParseContext context) {
        context.setAtLineStart(true);
        context.setInCodeBlock(false);
        context.setContinuingAlert(AlertType.NORMAL);
        while (!cursor.atEnd()) {
            if (context.atLineStart()) {
                context.setAtLineStart(false);
                if (blockScanner.scanLineStart(cursor, context).isPresent()) {
                    continue;
                }
            }
            int breakLength = cursor.lineBreakLengthAt(cursor.position());
            if (breakLength > 0) {
                context.closeLineSpans();
                context.append(cursor.source(), cursor.position(), cursor.position() + breakLength);
                cursor.advance(breakLength);
                context.setAtLineStart(true);
                continue;
            }
            if (inlineScanner.scan(cursor, context) || inlineScanner.scanEscape(cursor, context)) {
                continue;
            }
            context.append(cursor.peek());
            cursor.advance();
        }
        context.closeLineSpans();
        context.setInCodeBlock(false);
    }
}
