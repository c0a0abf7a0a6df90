package com.williamcallahan.mdcanvas.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings bound from {@code app.*}.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private ParseConfig parse = new ParseConfig();
    private RenderConfig render = new RenderConfig();
    private RenderCacheConfig cache = new RenderCacheConfig();

    /**
     * Validates every settings group, failing startup on the first invalid value.
     */
    @PostConstruct
    public void validateConfiguration() {
        parse.validateConfiguration();
        render.validateConfiguration();
        cache.validateConfiguration();
    }

    public ParseConfig getParse() {
        return parse;
    }

    public void setParse(ParseConfig parse) {
        this.parse = parse;
    }

    public RenderConfig getRender() {
        return render;
    }

    public void setRender(RenderConfig render) {
        this.render = render;
    }

    public RenderCacheConfig getCache() {
        return cache;
    }

    public void setCache(RenderCacheConfig cache) {
        this.cache = cache;
    }
}
