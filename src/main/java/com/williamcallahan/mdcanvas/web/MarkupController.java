package com.williamcallahan.mdcanvas.web;

import com.williamcallahan.mdcanvas.domain.errors.ApiResponse;
import com.williamcallahan.mdcanvas.domain.markup.ParsedMarkup;
import com.williamcallahan.mdcanvas.domain.render.MarkupClickRequest;
import com.williamcallahan.mdcanvas.domain.render.MarkupClickResponse;
import com.williamcallahan.mdcanvas.domain.render.MarkupHeightResponse;
import com.williamcallahan.mdcanvas.domain.render.MarkupParseResponse;
import com.williamcallahan.mdcanvas.domain.render.MarkupRenderRequest;
import com.williamcallahan.mdcanvas.domain.render.RenderCacheStatsSnapshot;
import com.williamcallahan.mdcanvas.service.MarkupRenderException;
import com.williamcallahan.mdcanvas.service.MarkupRenderService;
import jakarta.validation.Valid;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for parsing markup, rendering it to PNG and resolving clicks on rendered links.
 *
 * <p>Every content-carrying request must hold non-blank content. A width of 0 or an absent width
 * selects the configured default.</p>
 */
@RestController
@RequestMapping("/api/markup")
public class MarkupController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MarkupController.class);
    private static final String BLANK_CONTENT_MESSAGE = "Markup content must not be blank";

    private final MarkupRenderService markupRenderService;

    public MarkupController(MarkupRenderService markupRenderService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.markupRenderService = markupRenderService;
    }

    /**
     * Parses markup and returns its display text and span tables.
     *
     * @param request content to parse
     * @return display text and spans
     */
    @PostMapping(value = "/parse",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkupParseResponse> parse(@Valid @RequestBody MarkupRenderRequest request) {
        requireContent(request.isBlank());
        logger.debug("Parsing markup of length {}", request.content().length());
        try (ParsedMarkup parsed = markupRenderService.parse(request.content())) {
            return ResponseEntity.ok(MarkupParseResponse.from(parsed));
        }
    }

    /**
     * Renders markup to a PNG image.
     *
     * @param request content and width
     * @return PNG bytes
     */
    @PostMapping(value = "/render", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> render(@Valid @RequestBody MarkupRenderRequest request) {
        requireContent(request.isBlank());
        return ResponseEntity.ok()
            .contentType(MediaType.IMAGE_PNG)
            .body(markupRenderService.renderPng(request.content(), request.width()));
    }

    @PostMapping(value = "/height",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkupHeightResponse> height(@Valid @RequestBody MarkupRenderRequest request) {
        requireContent(request.isBlank());
        int width = markupRenderService.resolveWidth(request.width());
        int height = markupRenderService.measureHeight(request.content(), width);
        return ResponseEntity.ok(new MarkupHeightResponse(width, height));
    }

    /**
     * Resolves a click on a rendered image to the link under it, optionally opening the link.
     *
     * @param request content, width and click point
     * @return hit result
     */
    @PostMapping(value = "/click",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MarkupClickResponse> click(@Valid @RequestBody MarkupClickRequest request) {
        requireContent(request.isBlank());
        Optional<String> url = markupRenderService.resolveClick(
            request.content(), request.width(), request.x(), request.y());
        if (url.isEmpty()) {
            return ResponseEntity.ok(MarkupClickResponse.miss());
        }
        boolean opened = request.open()
            && markupRenderService.openLinkAt(request.content(), request.width(), request.x(), request.y());
        logger.info("Click at ({}, {}) hit {} (opened: {})", request.x(), request.y(), url.get(), opened);
        return ResponseEntity.ok(new MarkupClickResponse(true, url.get(), opened));
    }

    @GetMapping(value = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<RenderCacheStatsSnapshot> getCacheStats() {
        MarkupRenderService.CacheStats stats = markupRenderService.cacheStats();
        return ResponseEntity.ok(new RenderCacheStatsSnapshot(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            stats.size(),
            String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100)));
    }

    @PostMapping(value = "/cache/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> clearCache() {
        markupRenderService.clearCache();
        return createSuccessResponse("Render cache cleared successfully");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @Override
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return super.handleValidationException(validationException);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidRequest(MethodArgumentNotValidException invalidRequest) {
        String message = invalidRequest.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getDefaultMessage())
            .findFirst()
            .orElse("Invalid markup request");
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(MarkupRenderException.class)
    public ResponseEntity<ApiResponse> handleRenderException(MarkupRenderException renderException) {
        logger.error("Markup request failed", renderException);
        return handleServiceException(renderException, "render markup");
    }

    private static void requireContent(boolean blank) {
        if (blank) {
            throw new IllegalArgumentException(BLANK_CONTENT_MESSAGE);
        }
    }
}
