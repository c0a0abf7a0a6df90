package com.williamcallahan.mdcanvas.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.mdcanvas.config.AppProperties;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import com.williamcallahan.mdcanvas.service.markup.MarkupParser;
import com.williamcallahan.mdcanvas.service.render.MarkupRenderer;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies PNG rendering, caching and click resolution through the render service.
 */
class MarkupRenderServiceTest {
    private static final String LINK_MARKUP = "<md>[documentation link](https://docs.example)</md>";

    private AppProperties appProperties;
    private List<String> openedUrls;
    private MarkupRenderService service;

    @BeforeEach
    void createService() {
        appProperties = new AppProperties();
        openedUrls = new ArrayList<>();
        rebuildService();
    }

    private void rebuildService() {
        service = new MarkupRenderService(
            new MarkupParser(appProperties.getParse().toParserSettings()),
            new MarkupRenderer(),
            url -> openedUrls.add(url),
            appProperties);
    }

    private static BufferedImage decode(byte[] pngBytes) throws Exception {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(pngBytes));
        assertNotNull(image, "Bytes must decode to a valid image");
        return image;
    }

    @Test
    void renderPng_defaultWidth_producesDecodableImage() throws Exception {
        byte[] pngBytes = service.renderPng("<md># Title\nSome **bold** text</md>", 0);

        BufferedImage image = decode(pngBytes);
        assertEquals(appProperties.getRender().getDefaultWidth(), image.getWidth());
        assertEquals(service.measureHeight("<md># Title\nSome **bold** text</md>", 0), image.getHeight());
        assertTrue(image.getHeight() > 2 * appProperties.getRender().getPadding());
    }

    @Test
    void renderPng_repeatedRequest_isServedFromCacheAsCopy() {
        byte[] first = service.renderPng("cached text", 300);
        byte[] second = service.renderPng("cached text", 300);

        assertArrayEquals(first, second);
        assertNotSame(first, second);
        MarkupRenderService.CacheStats stats = service.cacheStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate());
    }

    @Test
    void renderPng_widthAboveMaximum_isRejected() {
        int tooWide = appProperties.getRender().getMaxWidth() + 1;

        assertThrows(IllegalArgumentException.class, () -> service.renderPng("text", tooWide));
    }

    @Test
    void measureHeight_isCappedAtMaximumHeight() {
        appProperties.getRender().setMaxHeight(40);
        rebuildService();

        assertEquals(40, service.measureHeight("line\n".repeat(100), 200));
    }

    @Test
    void resolveClick_pointOnLink_returnsUrl() {
        int padding = appProperties.getRender().getPadding();

        Optional<String> hit = service.resolveClick(LINK_MARKUP, 400, padding + 10, padding + 5);
        Optional<String> miss = service.resolveClick(LINK_MARKUP, 400, 390, 5);

        assertEquals(Optional.of("https://docs.example"), hit);
        assertTrue(miss.isEmpty());
    }

    @Test
    void openLinkAt_hitLink_isHandedToOpener() {
        int padding = appProperties.getRender().getPadding();

        assertTrue(service.openLinkAt(LINK_MARKUP, 400, padding + 10, padding + 5));
        assertFalse(service.openLinkAt(LINK_MARKUP, 400, 390, 5));

        assertEquals(List.of("https://docs.example"), openedUrls);
    }

    @Test
    void parse_oversizedInput_isTruncated() {
        appProperties.getParse().setMaxInputLength(5);
        rebuildService();

        try (ParsedMarkup parsed = service.parse("abcdefgh")) {
            assertEquals("abcde", parsed.displayText());
        }
    }

    @Test
    void parse_tooManySpans_raisesRenderException() {
        appProperties.getParse().setMaxSpansPerTable(1);
        rebuildService();

        assertThrows(MarkupRenderException.class, () -> service.parse("<md>[a](u) [b](u)</md>"));
    }

    @Test
    void clearCache_dropsRenderedImages() {
        service.renderPng("one", 100);
        service.renderPng("two", 100);

        service.clearCache();

        assertEquals(0, service.cacheStats().size());
    }
}
