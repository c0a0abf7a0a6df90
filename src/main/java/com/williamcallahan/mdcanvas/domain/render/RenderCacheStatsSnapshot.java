package com.williamcallahan.mdcanvas.domain.render;

import java.util.Objects;

/**
 * Render cache statistics as reported by the API.
 */
public record RenderCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) {
    public RenderCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }
}
