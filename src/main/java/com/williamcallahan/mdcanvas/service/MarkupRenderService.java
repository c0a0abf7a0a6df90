package com.williamcallahan.mdcanvas.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.mdcanvas.config.AppProperties;
import com.williamcallahan.mdcanvas.config.RenderConfig;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import com.williamcallahan.mdcanvas.service.markup.MarkupParser;
import com.williamcallahan.mdcanvas.service.markup.ResourceOpener;
import com.williamcallahan.mdcanvas.service.markup.SpanHitTester;
import com.williamcallahan.mdcanvas.service.render.Graphics2DSurface;
import com.williamcallahan.mdcanvas.service.render.MarkupRenderer;
import com.williamcallahan.mdcanvas.service.render.MeasuringSurface;
import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parses markup and renders it to PNG images, caching encoded images by content and width.
 *
 * <p>Every request parses its own {@link ParsedMarkup}; parse results are never shared between
 * threads. The image cache holds only immutable encoded bytes.</p>
 */
@Service
public class MarkupRenderService {

    private static final Logger logger = LoggerFactory.getLogger(MarkupRenderService.class);

    private static final String PNG_FORMAT = "png";
    private static final int SCRATCH_SIZE = 1;

    private final MarkupParser parser;
    private final MarkupRenderer renderer;
    private final ResourceOpener resourceOpener;
    private final AppProperties appProperties;
    private final Cache<RenderKey, byte[]> imageCache;

    private record RenderKey(String content, int width) {}

    /**
     * Canvas geometry resolved for one request.
     */
    private record CanvasLayout(int width, Rectangle target) {}

    /**
     * Creates the service with its parser, renderer and cache settings.
     */
    public MarkupRenderService(
            MarkupParser parser,
            MarkupRenderer renderer,
            ResourceOpener resourceOpener,
            AppProperties appProperties) {
        this.parser = Objects.requireNonNull(parser, "Markup parser cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "Markup renderer cannot be null");
        this.resourceOpener = Objects.requireNonNull(resourceOpener, "Resource opener cannot be null");
        this.appProperties = Objects.requireNonNull(appProperties, "App properties cannot be null");
        this.imageCache = Caffeine.newBuilder()
            .maximumSize(appProperties.getCache().getMaximumSize())
            .expireAfterWrite(appProperties.getCache().getExpireAfterWrite())
            .recordStats()
            .build();
        logger.info("MarkupRenderService initialized with cache size {} and TTL {}",
            appProperties.getCache().getMaximumSize(), appProperties.getCache().getExpireAfterWrite());
    }

    /**
     * Parses markup into display text and span tables.
     *
     * @param content raw text
     * @return parse result; the caller closes it
     * @throws MarkupRenderException when a span table cannot grow
     */
    public ParsedMarkup parse(String content) {
        return parseOrThrow(truncate(content));
    }

    /**
     * Renders markup to a PNG image.
     *
     * @param content raw text
     * @param requestedWidth image width in pixels, 0 or less for the configured default
     * @return encoded PNG bytes
     * @throws IllegalArgumentException when the width exceeds the configured maximum
     * @throws MarkupRenderException when parsing or encoding fails
     */
    public byte[] renderPng(String content, int requestedWidth) {
        String input = truncate(content);
        int width = resolveWidth(requestedWidth);
        RenderKey key = new RenderKey(input, width);
        byte[] cached = imageCache.getIfPresent(key);
        if (cached != null) {
            logger.debug("Render cache hit for width {}", width);
            return cached.clone();
        }
        byte[] encoded = renderUncached(input, width);
        imageCache.put(key, encoded);
        return encoded.clone();
    }

    /**
     * Computes the image height the markup needs at a width, padding included.
     *
     * @param content raw text
     * @param requestedWidth image width, 0 or less for the configured default
     * @return image height in pixels, capped at the configured maximum
     */
    public int measureHeight(String content, int requestedWidth) {
        String input = truncate(content);
        CanvasLayout layout = layoutFor(resolveWidth(requestedWidth));
        try (ParsedMarkup markup = parseOrThrow(input)) {
            return imageHeight(markup, layout);
        }
    }

    /**
     * Returns the link target under a point of the image {@link #renderPng} would produce.
     *
     * @param content raw text
     * @param requestedWidth image width, 0 or less for the configured default
     * @param x x in image pixels
     * @param y y in image pixels
     * @return link url, empty when the point is not on a link
     */
    public Optional<String> resolveClick(String content, int requestedWidth, int x, int y) {
        String input = truncate(content);
        CanvasLayout layout = layoutFor(resolveWidth(requestedWidth));
        try (ParsedMarkup markup = parseOrThrow(input)) {
            computeLinkBounds(markup, layout);
            return SpanHitTester.linkUrlAt(markup.links(), new Point(x, y));
        }
    }

    /**
     * Opens the link under a point through the host resource opener.
     *
     * @return true when a link was hit and the opener accepted it
     */
    public boolean openLinkAt(String content, int requestedWidth, int x, int y) {
        String input = truncate(content);
        CanvasLayout layout = layoutFor(resolveWidth(requestedWidth));
        try (ParsedMarkup markup = parseOrThrow(input)) {
            computeLinkBounds(markup, layout);
            return SpanHitTester.handleClick(markup.links(), new Point(x, y), resourceOpener);
        }
    }

    /**
     * Resolves a requested width against the configured default and maximum.
     *
     * @param requestedWidth width in pixels, 0 or less for the default
     * @return effective image width
     * @throws IllegalArgumentException when the width exceeds the configured maximum
     */
    public int resolveWidth(int requestedWidth) {
        RenderConfig render = appProperties.getRender();
        if (requestedWidth <= 0) {
            return render.getDefaultWidth();
        }
        if (requestedWidth > render.getMaxWidth()) {
            throw new IllegalArgumentException(
                "Width " + requestedWidth + " exceeds maximum " + render.getMaxWidth());
        }
        return requestedWidth;
    }

    /**
     * Returns image cache statistics.
     *
     * @return cache statistics
     */
    public CacheStats cacheStats() {
        var stats = imageCache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(),
            imageCache.estimatedSize());
    }

    /**
     * Drops every cached image.
     */
    public void clearCache() {
        imageCache.invalidateAll();
        logger.info("Render cache cleared");
    }

    /**
     * Image cache statistics.
     */
    public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {
        public double hitRate() {
            long total = hitCount + missCount;
            return total == 0 ? 0.0 : (double) hitCount / total;
        }
    }

    private byte[] renderUncached(String input, int width) {
        RenderConfig render = appProperties.getRender();
        CanvasLayout layout = layoutFor(width);
        try (ParsedMarkup markup = parseOrThrow(input)) {
            int height = imageHeight(markup, layout);
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
            Graphics2D graphics = image.createGraphics();
            try {
                graphics.setColor(render.background());
                graphics.fillRect(0, 0, width, height);
                graphics.setClip(0, 0, width, height);
                Graphics2DSurface surface = newSurface(graphics);
                surface.configureRenderingQuality();
                renderer.render(surface, markup, layout.target(), render.link(), render.normal());
            } finally {
                graphics.dispose();
            }
            logger.debug("Rendered {} spans into {}x{} image", markup.spanCount(), width, height);
            return encodePng(image);
        } catch (IOException encodeFailure) {
            throw new MarkupRenderException("Failed to encode markup image", encodeFailure);
        }
    }

    private void computeLinkBounds(ParsedMarkup markup, CanvasLayout layout) {
        int height = imageHeight(markup, layout);
        BufferedImage scratch = new BufferedImage(SCRATCH_SIZE, SCRATCH_SIZE, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scratch.createGraphics();
        try {
            graphics.setClip(0, 0, layout.width(), height);
            RenderConfig render = appProperties.getRender();
            renderer.render(new MeasuringSurface(newSurface(graphics)), markup, layout.target(),
                render.link(), render.normal());
        } finally {
            graphics.dispose();
        }
    }

    private int imageHeight(ParsedMarkup markup, CanvasLayout layout) {
        RenderConfig render = appProperties.getRender();
        BufferedImage scratch = new BufferedImage(SCRATCH_SIZE, SCRATCH_SIZE, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scratch.createGraphics();
        try {
            int contentHeight = renderer.measureHeight(newSurface(graphics), markup, layout.target());
            return Math.max(1, Math.min(render.getMaxHeight(), contentHeight + 2 * render.getPadding()));
        } finally {
            graphics.dispose();
        }
    }

    private Graphics2DSurface newSurface(Graphics2D graphics) {
        RenderConfig render = appProperties.getRender();
        return new Graphics2DSurface(graphics, render.getFontFamily(), render.getBaseFontSize());
    }

    private CanvasLayout layoutFor(int width) {
        int padding = appProperties.getRender().getPadding();
        int innerWidth = Math.max(1, width - 2 * padding);
        return new CanvasLayout(width, new Rectangle(padding, padding, innerWidth,
            appProperties.getRender().getMaxHeight()));
    }

    private ParsedMarkup parseOrThrow(String input) {
        if (input.isEmpty()) {
            return new ParsedMarkup(input, ParsedMarkup.Tables.empty());
        }
        return parser.parse(input)
            .orElseThrow(() -> new MarkupRenderException("Markup produced more spans than the parser allows"));
    }

    private String truncate(String content) {
        String input = content == null ? "" : content;
        int maxLength = appProperties.getParse().getMaxInputLength();
        if (input.length() > maxLength) {
            logger.warn("Markup content exceeds maximum length: {} > {}", input.length(), maxLength);
            return input.substring(0, maxLength);
        }
        return input;
    }

    private static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        if (!ImageIO.write(image, PNG_FORMAT, output)) {
            throw new IOException("No PNG writer available");
        }
        return output.toByteArray();
    }
}
