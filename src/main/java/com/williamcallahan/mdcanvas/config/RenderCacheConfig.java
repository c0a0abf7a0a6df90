package com.williamcallahan.mdcanvas.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Sizing of the rendered-image cache.
 */
public class RenderCacheConfig {

    private static final long MAX_SIZE_DEF = 500L;
    private static final Duration TTL_DEF = Duration.ofMinutes(30);
    private static final String MAX_SIZE_KEY = "app.cache.maximum-size";
    private static final String TTL_KEY = "app.cache.expire-after-write";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String POSITIVE_FMT = "%s must be a positive duration.";

    private long maximumSize = MAX_SIZE_DEF;
    private Duration expireAfterWrite = TTL_DEF;

    /**
     * Validates cache settings.
     */
    public void validateConfiguration() {
        if (maximumSize < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, MAX_SIZE_KEY));
        }
        if (expireAfterWrite == null || expireAfterWrite.isZero() || expireAfterWrite.isNegative()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TTL_KEY));
        }
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public Duration getExpireAfterWrite() {
        return expireAfterWrite;
    }

    public void setExpireAfterWrite(Duration expireAfterWrite) {
        this.expireAfterWrite = expireAfterWrite;
    }
}
