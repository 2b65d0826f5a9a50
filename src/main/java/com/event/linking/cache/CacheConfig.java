package com.event.linking.cache;

/**
 * Configuration for the analytics cache.
 *
 * @param maxSize    maximum number of snapshots kept
 * @param ttlSeconds time-to-live in seconds for each snapshot
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 64 snapshots, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(64, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
