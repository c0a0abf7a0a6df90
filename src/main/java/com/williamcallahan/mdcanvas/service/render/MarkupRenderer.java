package com.williamcallahan.mdcanvas.service.render;

import com.williamcallahan.mdcanvas.domain.markup.BlockquoteSpan;
import com.williamcallahan.mdcanvas.domain.markup.ColorTagSpan;
import com.williamcallahan.mdcanvas.domain.markup.FontTagSpan;
import com.williamcallahan.mdcanvas.domain.markup.HeadingSpan;
import com.williamcallahan.mdcanvas.domain.markup.LinkSpan;
import com.williamcallahan.mdcanvas.domain.markup.ListItemSpan;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import com.williamcallahan.mdcanvas.domain.markup.StyleKind;
import com.williamcallahan.mdcanvas.domain.markup.StyleSpan;
import com.williamcallahan.mdcanvas.service.markup.SpanHitTester;
import java.awt.Color;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Lays out and paints parsed markup in one forward pass over its display text.
 *
 * <p>Glyphs flow left to right inside the target rectangle and wrap before crossing its right edge.
 * Consecutive glyphs sharing a style and link are painted as one run, top-aligned to a common
 * baseline once their line is complete. Painting also records, for every link, the union of its
 * visible glyph boxes clipped to the target and the surface clip.</p>
 */
public class MarkupRenderer {

    private static final Color DEFAULT_MEASURE_COLOR = Color.BLACK;
    private static final int NO_LINK = -1;

    /**
     * Paints parsed markup and recomputes its link bounds.
     *
     * @param surface drawing surface
     * @param markup parse result
     * @param target rectangle to lay out in
     * @param linkColor color of link text
     * @param normalColor color of unstyled text
     * @return rendered height in pixels
     */
    public int render(
            DrawingSurface surface, ParsedMarkup markup, Rectangle target, Color linkColor, Color normalColor) {
        Objects.requireNonNull(linkColor, "Link color cannot be null");
        Objects.requireNonNull(normalColor, "Normal color cannot be null");
        for (LinkSpan link : markup.links()) {
            link.resetBounds();
        }
        return new LayoutPass(surface, markup, target, linkColor, normalColor, true).run();
    }

    /**
     * Computes the height a render would take without painting or touching link bounds.
     *
     * @param surface surface used for measuring
     * @param markup parse result
     * @param target rectangle to lay out in
     * @return rendered height in pixels
     */
    public int measureHeight(DrawingSurface surface, ParsedMarkup markup, Rectangle target) {
        return new LayoutPass(surface, markup, target, DEFAULT_MEASURE_COLOR, DEFAULT_MEASURE_COLOR, false).run();
    }

    private record PlacedRun(String text, int x, int width, RunMetrics metrics, TextRunStyle style, int linkIndex) {}

    /**
     * State of one layout walk.
     */
    private static final class LayoutPass {
        private final DrawingSurface surface;
        private final ParsedMarkup markup;
        private final Rectangle target;
        private final Color linkColor;
        private final Color normalColor;
        private final boolean paint;
        private final Rectangle clip;

        private final List<PlacedRun> lineRuns = new ArrayList<>();
        private final StringBuilder runText = new StringBuilder();
        private TextRunStyle runStyle;
        private int runLink = NO_LINK;
        private int runX;
        private int runWidth;
        private int runHeight;
        private int runAscent;

        private int penX;
        private int lineTop;
        private int lineHeight;
        private int lineAscent;
        private int baseHeight;

        LayoutPass(
                DrawingSurface surface,
                ParsedMarkup markup,
                Rectangle target,
                Color linkColor,
                Color normalColor,
                boolean paint) {
            this.surface = Objects.requireNonNull(surface, "Drawing surface cannot be null");
            this.markup = Objects.requireNonNull(markup, "Parsed markup cannot be null");
            this.target = new Rectangle(Objects.requireNonNull(target, "Target rectangle cannot be null"));
            this.linkColor = linkColor;
            this.normalColor = normalColor;
            this.paint = paint;
            Rectangle surfaceClip = surface.clipBounds();
            this.clip = surfaceClip == null ? null : new Rectangle(surfaceClip);
        }

        int run() {
            String text = markup.displayText();
            baseHeight = surface.measure(" ", TextRunStyle.plain(normalColor)).height();
            penX = target.x;
            lineTop = target.y;

            for (int position = 0; position < text.length(); position++) {
                char current = text.charAt(position);
                if (current == '\r' && position + 1 < text.length() && text.charAt(position + 1) == '\n') {
                    continue;
                }
                if (current == '\n' || current == '\r') {
                    finishLine();
                    continue;
                }
                applyBlockIndent(position);
                TextRunStyle style = styleAt(position);
                if (!surface.canDisplay(current, style)) {
                    continue;
                }
                RunMetrics glyph = surface.measure(String.valueOf(current), style);
                boolean lineHasGlyphs = !lineRuns.isEmpty() || runText.length() > 0;
                if (lineHasGlyphs && penX + glyph.width() > target.x + target.width) {
                    finishLine();
                }
                placeGlyph(current, glyph, style, linkIndexAt(position));
            }
            flushRun();
            layoutLine();
            return lineTop + currentLineHeight() - target.y;
        }

        private void applyBlockIndent(int position) {
            int indent = 0;
            OptionalInt listItem = SpanHitTester.spanStartingAt(markup.listItems(), position);
            if (listItem.isPresent()) {
                ListItemSpan item = markup.listItems().get(listItem.getAsInt());
                indent += RenderTheme.listIndent(item.indentLevel());
            }
            if (SpanHitTester.spanStartingAt(markup.blockquotes(), position).isPresent()) {
                indent += RenderTheme.BLOCKQUOTE_INDENT;
            }
            if (indent > 0) {
                // runs are painted from their first glyph, so a jump in the pen starts a new one
                flushRun();
                penX += indent;
            }
        }

        private int linkIndexAt(int position) {
            return SpanHitTester.positionInSpan(markup.links(), position).orElse(NO_LINK);
        }

        private TextRunStyle styleAt(int position) {
            float scale = 1.0f;
            boolean bold = false;
            boolean italic = false;
            boolean monospace = false;
            boolean strikethrough = false;

            Optional<HeadingSpan> heading = SpanHitTester.spanAt(markup.headings(), position);
            if (heading.isPresent()) {
                scale = RenderTheme.headingScale(heading.get().level());
                bold = true;
            }
            for (StyleSpan style : markup.styles()) {
                if (style.startPos() > position) {
                    break;
                }
                if (!style.contains(position)) {
                    continue;
                }
                bold |= style.kind().isBold();
                italic |= style.kind().isItalic();
                monospace |= style.kind() == StyleKind.CODE;
                strikethrough |= style.kind() == StyleKind.STRIKETHROUGH;
            }
            Optional<BlockquoteSpan> blockquote = SpanHitTester.spanAt(markup.blockquotes(), position);
            italic |= blockquote.isPresent();

            String family = null;
            for (FontTagSpan fontTag : markup.fontTags()) {
                if (fontTag.contains(position)) {
                    family = fontTag.fontName();
                }
            }
            Color color = colorAt(position, monospace, blockquote);
            return new TextRunStyle(family, scale, bold, italic, monospace, strikethrough, color);
        }

        private Color colorAt(int position, boolean code, Optional<BlockquoteSpan> blockquote) {
            if (SpanHitTester.positionInSpan(markup.links(), position).isPresent()) {
                return linkColor;
            }
            if (code) {
                return RenderTheme.CODE_COLOR;
            }
            ColorTagSpan innermost = null;
            for (ColorTagSpan colorTag : markup.colorTags()) {
                if (colorTag.contains(position)) {
                    innermost = colorTag;
                }
            }
            if (innermost != null) {
                return innermost.colorAt(position);
            }
            return blockquote.map(span -> RenderTheme.alertColor(span.alertType())).orElse(normalColor);
        }

        private void placeGlyph(char glyphChar, RunMetrics glyph, TextRunStyle style, int linkIndex) {
            if (runText.length() > 0 && (!style.equals(runStyle) || linkIndex != runLink)) {
                flushRun();
            }
            if (runText.length() == 0) {
                runStyle = style;
                runLink = linkIndex;
                runX = penX;
                runWidth = 0;
                runHeight = 0;
                runAscent = 0;
            }
            runText.append(glyphChar);
            runWidth += glyph.width();
            runHeight = Math.max(runHeight, glyph.height());
            runAscent = Math.max(runAscent, glyph.ascent());
            penX += glyph.width();
            lineHeight = Math.max(lineHeight, glyph.height());
            lineAscent = Math.max(lineAscent, glyph.ascent());
        }

        private void flushRun() {
            if (runText.length() == 0) {
                return;
            }
            RunMetrics metrics = new RunMetrics(runWidth, runHeight, runAscent);
            lineRuns.add(new PlacedRun(runText.toString(), runX, runWidth, metrics, runStyle, runLink));
            runText.setLength(0);
        }

        private void finishLine() {
            flushRun();
            layoutLine();
            lineTop += currentLineHeight();
            penX = target.x;
            lineHeight = 0;
            lineAscent = 0;
        }

        private int currentLineHeight() {
            return lineHeight > 0 ? lineHeight : baseHeight;
        }

        /**
         * Paints the finished line and records link boxes on it.
         */
        private void layoutLine() {
            for (PlacedRun placed : lineRuns) {
                int runTop = lineTop + (lineAscent - placed.metrics().ascent());
                Rectangle box = new Rectangle(placed.x(), runTop, placed.width(), placed.metrics().height());
                boolean visible = clip == null || box.intersects(clip);
                if (paint && visible) {
                    surface.drawRun(placed.text(), placed.x(), runTop, placed.style());
                }
                if (paint && placed.linkIndex() != NO_LINK) {
                    Rectangle visibleBox = box.intersection(target);
                    if (clip != null) {
                        visibleBox = visibleBox.intersection(clip);
                    }
                    markup.links().get(placed.linkIndex()).includeInBounds(visibleBox);
                }
            }
            lineRuns.clear();
        }
    }
}
