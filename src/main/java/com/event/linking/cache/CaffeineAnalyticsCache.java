package com.event.linking.cache;

import com.event.linking.analytics.AnalyticsSnapshot;
import com.event.linking.analytics.TimeGranularity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed analytics cache.
 */
public class CaffeineAnalyticsCache implements AnalyticsCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAnalyticsCache.class);

    private final Cache<CacheKey, AnalyticsSnapshot> cache;

    public CaffeineAnalyticsCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineAnalyticsCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<AnalyticsSnapshot> get(long storeVersion, TimeGranularity granularity) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(storeVersion, granularity)));
    }

    @Override
    public void put(AnalyticsSnapshot snapshot) {
        cache.put(new CacheKey(snapshot.storeVersion(), snapshot.granularity()), snapshot);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all analytics snapshots");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(long storeVersion, TimeGranularity granularity) {}
}
