package com.event.linking.cache;

import com.event.linking.analytics.AnalyticsSnapshot;
import com.event.linking.analytics.TimeGranularity;

import java.util.Optional;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpAnalyticsCache implements AnalyticsCache {

    @Override
    public Optional<AnalyticsSnapshot> get(long storeVersion, TimeGranularity granularity) {
        return Optional.empty();
    }

    @Override
    public void put(AnalyticsSnapshot snapshot) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
