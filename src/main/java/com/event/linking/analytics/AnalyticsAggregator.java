package com.event.linking.analytics;

import com.event.linking.cache.AnalyticsCache;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventMember;
import com.event.linking.core.model.Scope;
import com.event.linking.metrics.MetricsService;
import com.event.linking.severity.SeverityScorer;
import com.event.linking.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Timelines and breakdowns over surviving events.
 *
 * <p>An event is bucketed by its start date, or by the UTC date of its earliest member's
 * publication when the start date is unknown. Each bucket carries the event count, the sum of
 * severities and breakdowns by sector, scope and event type. Snapshots are cached by store
 * version and granularity.</p>
 */
public class AnalyticsAggregator {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsAggregator.class);

    public static final String UNKNOWN = "unknown";

    private static final int MAX_SNAPSHOT_ATTEMPTS = 3;

    private final EventStore eventStore;
    private final AnalyticsCache cache;
    private final MetricsService metrics;

    public AnalyticsAggregator(EventStore eventStore, AnalyticsCache cache, MetricsService metrics) {
        this.eventStore = eventStore;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Snapshot of the current store. Only snapshots read from a store that did not change while
     * reading are cached.
     */
    public AnalyticsSnapshot snapshot(TimeGranularity granularity) {
        long version = eventStore.version();
        Optional<AnalyticsSnapshot> cached = cache.get(version, granularity);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        AnalyticsSnapshot snapshot = null;
        for (int attempt = 1; attempt <= MAX_SNAPSHOT_ATTEMPTS; attempt++) {
            List<Event> events = eventStore.findSurviving();
            long after = eventStore.version();
            snapshot = aggregate(events, granularity, after);
            if (after == version) {
                cache.put(snapshot);
                break;
            }
            version = after;
        }
        log.debug("analytics.computed granularity={} storeVersion={} buckets={} events={}",
                granularity, snapshot.storeVersion(), snapshot.buckets().size(), snapshot.totalEvents());
        return snapshot;
    }

    /**
     * Aggregates the given events. Absorbed events are skipped.
     */
    public AnalyticsSnapshot aggregate(Collection<Event> events, TimeGranularity granularity, long storeVersion) {
        Map<LocalDate, List<Event>> byBucket = new TreeMap<>();
        for (Event event : events) {
            if (event.isAbsorbed()) {
                continue;
            }
            bucketDate(event).ifPresent(date ->
                    byBucket.computeIfAbsent(granularity.bucketStart(date), k -> new ArrayList<>()).add(event));
        }

        List<BucketSummary> buckets = new ArrayList<>();
        long total = 0;
        for (Map.Entry<LocalDate, List<Event>> entry : byBucket.entrySet()) {
            List<Event> bucketEvents = entry.getValue();
            total += bucketEvents.size();
            buckets.add(new BucketSummary(
                    entry.getKey(),
                    granularity.label(entry.getKey()),
                    bucketEvents.size(),
                    severitySum(bucketEvents),
                    breakdown(bucketEvents, e -> e.getSector() != null ? e.getSector() : UNKNOWN,
                            Comparator.naturalOrder()),
                    breakdown(bucketEvents, e -> e.getScope() != null ? e.getScope().name() : UNKNOWN,
                            Comparator.comparingInt(AnalyticsAggregator::scopeRank)),
                    breakdown(bucketEvents, e -> e.getEventType() != null ? e.getEventType().name() : UNKNOWN,
                            Comparator.naturalOrder())));
        }
        return new AnalyticsSnapshot(granularity, storeVersion, buckets, total);
    }

    /**
     * The date an event is bucketed by.
     */
    static Optional<LocalDate> bucketDate(Event event) {
        if (event.getStartDate() != null) {
            return Optional.of(event.getStartDate());
        }
        return event.getMembers().stream()
                .map(EventMember::publishedAt)
                .min(Comparator.naturalOrder())
                .map(published -> published.atZone(ZoneOffset.UTC).toLocalDate());
    }

    private static List<BreakdownEntry> breakdown(List<Event> events, Function<Event, String> dimension,
                                                  Comparator<String> order) {
        Map<String, List<Event>> grouped = new TreeMap<>(order);
        for (Event event : events) {
            grouped.computeIfAbsent(dimension.apply(event), k -> new ArrayList<>()).add(event);
        }
        List<BreakdownEntry> entries = new ArrayList<>();
        grouped.forEach((value, group) -> entries.add(new BreakdownEntry(value, group.size(), severitySum(group))));
        return entries;
    }

    private static double severitySum(List<Event> events) {
        return SeverityScorer.round(events.stream().mapToDouble(Event::getSeverity).sum());
    }

    private static int scopeRank(String value) {
        return UNKNOWN.equals(value) ? Integer.MAX_VALUE : Scope.valueOf(value).ordinal();
    }
}
