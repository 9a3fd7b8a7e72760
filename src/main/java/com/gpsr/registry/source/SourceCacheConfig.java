package com.gpsr.registry.source;

/**
 * Configuration for the {@code (type, identifier)} source lookup cache.
 *
 * @param maxSize    maximum number of cached sources
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether lookups are cached at all
 */
public record SourceCacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public SourceCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 entries, 600s TTL, enabled.
     */
    public static SourceCacheConfig defaults() {
        return new SourceCacheConfig(1_000, 600, true);
    }

    public static SourceCacheConfig disabled() {
        return new SourceCacheConfig(1, 1, false);
    }
}
