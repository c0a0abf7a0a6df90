package com.williamcallahan.mdcanvas.domain.render;

import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import java.util.List;

/**
 * JSON view of a parse result: the display text and every span table.
 */
public record MarkupParseResponse(
    String displayText,
    List<LinkView> links,
    List<HeadingView> headings,
    List<StyleView> styles,
    List<ListItemView> listItems,
    List<BlockquoteView> blockquotes,
    List<ColorTagView> colorTags,
    List<FontTagView> fontTags
) {

    public record LinkView(String text, String url, int startPos, int endPos) {}

    public record HeadingView(int level, int startPos, int endPos) {}

    public record StyleView(String kind, int startPos, int endPos) {}

    public record ListItemView(int startPos, int endPos, int indentLevel, boolean checked, boolean ordered,
                               boolean taskItem) {}

    public record BlockquoteView(String alertType, int depth, int startPos, int endPos) {}

    public record ColorTagView(String value, boolean gradient, int startPos, int endPos) {}

    public record FontTagView(String fontName, int startPos, int endPos) {}

    /**
     * Copies a parse result into its JSON view.
     *
     * @param parsed parse result
     * @return view holding no references to the result
     */
    public static MarkupParseResponse from(ParsedMarkup parsed) {
        return new MarkupParseResponse(
            parsed.displayText(),
            parsed.links().asList().stream()
                .map(link -> new LinkView(link.text(), link.url(), link.startPos(), link.endPos()))
                .toList(),
            parsed.headings().asList().stream()
                .map(heading -> new HeadingView(heading.level(), heading.startPos(), heading.endPos()))
                .toList(),
            parsed.styles().asList().stream()
                .map(style -> new StyleView(style.kind().name(), style.startPos(), style.endPos()))
                .toList(),
            parsed.listItems().asList().stream()
                .map(item -> new ListItemView(item.startPos(), item.endPos(), item.indentLevel(), item.checked(),
                    item.ordered(), item.taskItem()))
                .toList(),
            parsed.blockquotes().asList().stream()
                .map(quote -> new BlockquoteView(quote.alertType().name(), quote.depth(), quote.startPos(),
                    quote.endPos()))
                .toList(),
            parsed.colorTags().asList().stream()
                .map(tag -> new ColorTagView(tag.value(), tag.isGradient(), tag.startPos(), tag.endPos()))
                .toList(),
            parsed.fontTags().asList().stream()
                .map(tag -> new FontTagView(tag.fontName(), tag.startPos(), tag.endPos()))
                .toList());
    }
}
