package com.event.linking.cache;

import com.event.linking.analytics.AnalyticsSnapshot;
import com.event.linking.analytics.TimeGranularity;

import java.util.Optional;

/**
 * Cache of analytics snapshots keyed by store version and granularity.
 * A snapshot is immutable for its store version, so entries never need invalidating on writes;
 * a write bumps the store version and later lookups miss.
 */
public interface AnalyticsCache {

    Optional<AnalyticsSnapshot> get(long storeVersion, TimeGranularity granularity);

    void put(AnalyticsSnapshot snapshot);

    void invalidateAll();

    CacheStats getStats();
}
