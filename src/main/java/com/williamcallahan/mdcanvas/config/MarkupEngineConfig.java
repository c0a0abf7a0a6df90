package com.williamcallahan.mdcanvas.config;

import com.williamcallahan.mdcanvas.service.markup.DesktopResourceOpener;
import com.williamcallahan.mdcanvas.service.markup.MarkupParser;
import com.williamcallahan.mdcanvas.service.markup.ResourceOpener;
import com.williamcallahan.mdcanvas.service.render.MarkupRenderer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the markup engine components.
 */
@Configuration
public class MarkupEngineConfig {

    /**
     * Creates the parser with the configured delimiters and limits.
     *
     * @param appProperties application settings
     * @return markup parser
     */
    @Bean
    public MarkupParser markupParser(AppProperties appProperties) {
        return new MarkupParser(appProperties.getParse().toParserSettings());
    }

    @Bean
    public MarkupRenderer markupRenderer() {
        return new MarkupRenderer();
    }

    @Bean
    public ResourceOpener resourceOpener() {
        return new DesktopResourceOpener();
    }
}
