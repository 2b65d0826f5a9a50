package com.event.linking.cdi;

import com.event.linking.api.EventLinker;
import com.event.linking.api.LinkingOptions;
import com.event.linking.cache.CacheConfig;
import com.event.linking.dedup.DuplicateDetectionConfig;
import com.event.linking.lock.LockConfig;
import com.event.linking.metrics.MicrometerMetricsService;
import com.event.linking.similarity.SimilarityWeights;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires the event linking library from MicroProfile Config properties.
 *
 * <p>Every key has a default, so an empty configuration yields the library defaults:</p>
 * <pre>
 * event-linking:
 *   matching:
 *     acceptance-threshold: 0.55
 *     match-window-days: 14
 *   lifecycle:
 *     dormancy-window-days: 14
 *     closure-window-days: 45
 *   maintenance:
 *     period-minutes: 60
 * </pre>
 *
 * <p>When the container provides a Micrometer {@link MeterRegistry}, metrics are recorded in it.</p>
 */
@ApplicationScoped
public class EventLinkingProducer {

    private static final Logger log = LoggerFactory.getLogger(EventLinkingProducer.class);

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.matching.acceptance-threshold", defaultValue = "0.55")
    double acceptanceThreshold;

    @Inject
    @ConfigProperty(name = "event-linking.matching.reconciliation-threshold", defaultValue = "0.70")
    double reconciliationThreshold;

    @Inject
    @ConfigProperty(name = "event-linking.matching.low-confidence-threshold", defaultValue = "0.5")
    double lowConfidenceThreshold;

    @Inject
    @ConfigProperty(name = "event-linking.matching.text-weight", defaultValue = "0.6")
    double textWeight;

    @Inject
    @ConfigProperty(name = "event-linking.matching.match-window-days", defaultValue = "14")
    int matchWindowDays;

    @Inject
    @ConfigProperty(name = "event-linking.matching.max-assignment-retries", defaultValue = "3")
    int maxAssignmentRetries;

    // ── Duplicates ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.dedup.max-hamming-distance", defaultValue = "3")
    int maxHammingDistance;

    @Inject
    @ConfigProperty(name = "event-linking.dedup.window-days", defaultValue = "3")
    int duplicateWindowDays;

    // ── Lifecycle ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.lifecycle.dormancy-window-days", defaultValue = "14")
    int dormancyWindowDays;

    @Inject
    @ConfigProperty(name = "event-linking.lifecycle.closure-window-days", defaultValue = "45")
    int closureWindowDays;

    @Inject
    @ConfigProperty(name = "event-linking.lifecycle.closed-merge-grace-days", defaultValue = "7")
    int closedMergeGraceDays;

    // ── Batches and locks ─────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.batch.max-size", defaultValue = "10000")
    int maxBatchSize;

    @Inject
    @ConfigProperty(name = "event-linking.batch.parallelism", defaultValue = "4")
    int batchParallelism;

    @Inject
    @ConfigProperty(name = "event-linking.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "event-linking.cache.max-size", defaultValue = "64")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "event-linking.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Maintenance ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "event-linking.maintenance.period-minutes", defaultValue = "0")
    long maintenancePeriodMinutes;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public EventLinker eventLinker() {
        LinkingOptions options = linkingOptions();
        log.info("Producing EventLinker: {}", options);

        EventLinker.Builder builder = EventLinker.builder()
                .options(options)
                .lockConfig(new LockConfig(lockTimeoutMs, 0, 100))
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled());

        if (meterRegistry != null && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Micrometer metrics enabled");
        }

        EventLinker linker = builder.build();
        if (maintenancePeriodMinutes > 0) {
            linker.startMaintenance(Duration.ofMinutes(maintenancePeriodMinutes));
        }
        return linker;
    }

    public void closeLinker(@Disposes EventLinker linker) {
        log.info("Closing EventLinker");
        linker.close();
    }

    LinkingOptions linkingOptions() {
        DuplicateDetectionConfig dedup = DuplicateDetectionConfig.defaults()
                .withMaxHammingDistance(maxHammingDistance)
                .withWindow(Duration.ofDays(duplicateWindowDays));
        return LinkingOptions.builder()
                .acceptanceThreshold(acceptanceThreshold)
                .reconciliationThreshold(reconciliationThreshold)
                .lowConfidenceThreshold(lowConfidenceThreshold)
                .similarityWeights(new SimilarityWeights(textWeight, 1.0 - textWeight))
                .matchWindow(Duration.ofDays(matchWindowDays))
                .dormancyWindow(Duration.ofDays(dormancyWindowDays))
                .closureWindow(Duration.ofDays(closureWindowDays))
                .closedMergeGracePeriod(Duration.ofDays(closedMergeGraceDays))
                .maxAssignmentRetries(maxAssignmentRetries)
                .maxBatchSize(maxBatchSize)
                .batchParallelism(batchParallelism)
                .duplicateDetection(dedup)
                .build();
    }
}
