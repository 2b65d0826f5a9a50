package com.event.linking.metrics;

import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.EventState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code event.linking.ingest.duration}: Timer (tag: outcome)</li>
 *   <li>{@code event.linking.duplicates}: Counter (tag: kind)</li>
 *   <li>{@code event.linking.low.confidence}: Counter</li>
 *   <li>{@code event.linking.stale.retries}: Counter</li>
 *   <li>{@code event.linking.ingest.failures}: Counter</li>
 *   <li>{@code event.linking.lifecycle.transitions}: Counter (tags: from, to)</li>
 *   <li>{@code event.linking.events.merged}: Counter</li>
 *   <li>{@code event.linking.reconciliation.duration}: Timer</li>
 *   <li>{@code event.linking.match.score}: DistributionSummary</li>
 *   <li>{@code event.linking.batch.size}: DistributionSummary</li>
 *   <li>{@code event.linking.analytics.cache.hit} / {@code .miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter lowConfidenceCounter;
    private final Counter staleRetryCounter;
    private final Counter ingestFailureCounter;
    private final Counter mergedCounter;
    private final Timer reconciliationTimer;
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.lowConfidenceCounter = Counter.builder("event.linking.low.confidence")
                .description("Articles assigned with low-confidence attributes")
                .register(registry);
        this.staleRetryCounter = Counter.builder("event.linking.stale.retries")
                .description("Assignments retried after a concurrent event update")
                .register(registry);
        this.ingestFailureCounter = Counter.builder("event.linking.ingest.failures")
                .description("Ingestions rolled back after a failure")
                .register(registry);
        this.mergedCounter = Counter.builder("event.linking.events.merged")
                .description("Events absorbed by reconciliation")
                .register(registry);
        this.reconciliationTimer = Timer.builder("event.linking.reconciliation.duration")
                .description("Duration of reconciliation passes")
                .register(registry);
        this.matchScoreSummary = DistributionSummary.builder("event.linking.match.score")
                .description("Best candidate score per clustered article")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("event.linking.batch.size")
                .description("Distribution of ingested batch sizes")
                .register(registry);
        this.cacheHitCounter = Counter.builder("event.linking.analytics.cache.hit")
                .description("Analytics snapshot cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("event.linking.analytics.cache.miss")
                .description("Analytics snapshot cache misses")
                .register(registry);
    }

    @Override
    public void recordIngestDuration(AssignmentOutcome outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome.name(), k ->
                Timer.builder("event.linking.ingest.duration")
                        .description("Duration of article ingestion")
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementDuplicateDetected(String matchKind) {
        counter("duplicates:" + matchKind, () -> Counter.builder("event.linking.duplicates")
                .description("Articles identified as duplicates")
                .tag("kind", matchKind)
                .register(registry)).increment();
    }

    @Override
    public void incrementLowConfidence() {
        lowConfidenceCounter.increment();
    }

    @Override
    public void incrementStaleRetry() {
        staleRetryCounter.increment();
    }

    @Override
    public void incrementIngestFailure() {
        ingestFailureCounter.increment();
    }

    @Override
    public void incrementLifecycleTransition(EventState from, EventState to) {
        counter("transition:" + from + ":" + to, () -> Counter.builder("event.linking.lifecycle.transitions")
                .description("Event state transitions")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)).increment();
    }

    @Override
    public void incrementEventsMerged(int count) {
        mergedCounter.increment(count);
    }

    @Override
    public void recordReconciliationDuration(Duration duration) {
        reconciliationTimer.record(duration);
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
