package com.williamcallahan.mdcanvas.web;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.mdcanvas.service.MarkupRenderException;
import com.williamcallahan.mdcanvas.service.MarkupRenderService;
import com.williamcallahan.mdcanvas.service.markup.MarkupParser;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies request validation, response shapes and error mapping of the markup endpoints.
 */
@WebMvcTest(controllers = MarkupController.class)
@Import(ExceptionResponseBuilder.class)
class MarkupControllerTest {
    private static final String LINK_BODY = "{\"content\":\"<md>[GitHub](https://github.com)</md>\",\"width\":300}";

    @Autowired
    MockMvc mvc;

    @MockitoBean
    MarkupRenderService markupRenderService;

    @Test
    void parse_returnsDisplayTextAndSpans() throws Exception {
        when(markupRenderService.parse(anyString()))
            .thenAnswer(invocation -> new MarkupParser().parse(invocation.getArgument(0)).orElseThrow());

        mvc.perform(post("/api/markup/parse").contentType(MediaType.APPLICATION_JSON).content(LINK_BODY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.displayText").value("GitHub"))
            .andExpect(jsonPath("$.links", hasSize(1)))
            .andExpect(jsonPath("$.links[0].url").value("https://github.com"))
            .andExpect(jsonPath("$.links[0].endPos").value(6));
    }

    @Test
    void parse_blankContent_isBadRequest() throws Exception {
        mvc.perform(post("/api/markup/parse").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value("error"))
            .andExpect(jsonPath("$.message").value("Markup content must not be blank"));

        verify(markupRenderService, never()).parse(anyString());
    }

    @Test
    void render_returnsPngBytes() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(markupRenderService.renderPng(anyString(), eq(300))).thenReturn(png);

        mvc.perform(post("/api/markup/render").contentType(MediaType.APPLICATION_JSON).content(LINK_BODY))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG))
            .andExpect(content().bytes(png));
    }

    @Test
    void render_negativeWidth_isBadRequest() throws Exception {
        mvc.perform(post("/api/markup/render").contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"x\",\"width\":-5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("width")));
    }

    @Test
    void render_failure_isServerErrorWithDetails() throws Exception {
        when(markupRenderService.renderPng(anyString(), anyInt()))
            .thenThrow(new MarkupRenderException("Markup produced more spans than the parser allows"));

        mvc.perform(post("/api/markup/render").contentType(MediaType.APPLICATION_JSON).content(LINK_BODY))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Failed to render markup"))
            .andExpect(jsonPath("$.details", containsString("MarkupRenderException")));
    }

    @Test
    void height_reportsResolvedWidth() throws Exception {
        when(markupRenderService.resolveWidth(0)).thenReturn(600);
        when(markupRenderService.measureHeight("abc", 600)).thenReturn(33);

        mvc.perform(post("/api/markup/height").contentType(MediaType.APPLICATION_JSON).content("{\"content\":\"abc\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.width").value(600))
            .andExpect(jsonPath("$.height").value(33));
    }

    @Test
    void click_hit_opensWhenRequested() throws Exception {
        when(markupRenderService.resolveClick(anyString(), eq(300), eq(12), eq(14)))
            .thenReturn(Optional.of("https://github.com"));
        when(markupRenderService.openLinkAt(anyString(), eq(300), eq(12), eq(14))).thenReturn(true);

        mvc.perform(post("/api/markup/click").contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"<md>[GitHub](https://github.com)</md>\",\"width\":300,"
                    + "\"x\":12,\"y\":14,\"open\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hit").value(true))
            .andExpect(jsonPath("$.url").value("https://github.com"))
            .andExpect(jsonPath("$.opened").value(true));
    }

    @Test
    void click_miss_doesNotOpen() throws Exception {
        when(markupRenderService.resolveClick(anyString(), anyInt(), anyInt(), anyInt())).thenReturn(Optional.empty());

        mvc.perform(post("/api/markup/click").contentType(MediaType.APPLICATION_JSON)
                .content("{\"content\":\"plain\",\"x\":1,\"y\":1,\"open\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hit").value(false))
            .andExpect(jsonPath("$.opened").value(false));

        verify(markupRenderService, never()).openLinkAt(anyString(), anyInt(), anyInt(), anyInt());
    }

    @Test
    void cacheStats_formatsHitRate() throws Exception {
        when(markupRenderService.cacheStats()).thenReturn(new MarkupRenderService.CacheStats(3, 1, 0, 2));

        mvc.perform(get("/api/markup/cache/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hitCount").value(3))
            .andExpect(jsonPath("$.size").value(2))
            .andExpect(jsonPath("$.hitRate").value("75.00%"));
    }

    @Test
    void cacheClear_acknowledges() throws Exception {
        mvc.perform(post("/api/markup/cache/clear"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("success"));

        verify(markupRenderService).clearCache();
    }
}
