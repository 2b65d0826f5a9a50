package com.event.linking.api;

import com.event.linking.analytics.AnalyticsAggregator;
import com.event.linking.analytics.AnalyticsSnapshot;
import com.event.linking.analytics.TimeGranularity;
import com.event.linking.audit.AuditRepository;
import com.event.linking.audit.AuditService;
import com.event.linking.audit.InMemoryAuditRepository;
import com.event.linking.audit.MergeLedger;
import com.event.linking.cache.AnalyticsCache;
import com.event.linking.cache.CacheConfig;
import com.event.linking.cache.CaffeineAnalyticsCache;
import com.event.linking.cache.NoOpAnalyticsCache;
import com.event.linking.cluster.EventAggregation;
import com.event.linking.cluster.EventClusterer;
import com.event.linking.cluster.EventLifecycleManager;
import com.event.linking.cluster.LifecycleTransition;
import com.event.linking.cluster.ReconciliationResult;
import com.event.linking.cluster.ReconciliationService;
import com.event.linking.core.model.ArticleAssignment;
import com.event.linking.core.model.ArticleRecord;
import com.event.linking.core.model.Event;
import com.event.linking.core.model.EventKey;
import com.event.linking.core.model.EventState;
import com.event.linking.dedup.NearDuplicateDetector;
import com.event.linking.dedup.TextFingerprinter;
import com.event.linking.lock.LocalShardLock;
import com.event.linking.lock.LockConfig;
import com.event.linking.lock.ShardLock;
import com.event.linking.logging.LogContext;
import com.event.linking.merge.EventMergeEngine;
import com.event.linking.metrics.MetricsService;
import com.event.linking.metrics.NoOpMetricsService;
import com.event.linking.rules.DefaultNormalizationRules;
import com.event.linking.rules.NormalizationEngine;
import com.event.linking.severity.SeverityScorer;
import com.event.linking.similarity.CosineSimilarity;
import com.event.linking.similarity.EventKeyBuilder;
import com.event.linking.similarity.EventSimilarityScorer;
import com.event.linking.store.ArticleRepository;
import com.event.linking.store.EventStore;
import com.event.linking.store.InMemoryArticleRepository;
import com.event.linking.store.InMemoryEventStore;
import com.event.linking.tracing.NoOpTracingService;
import com.event.linking.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the event linking library.
 * Groups news articles into real-world labour actions, detects syndicated copies and serves
 * analytics over the result.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (EventLinker linker = EventLinker.builder()
 *         .options(LinkingOptions.defaults())
 *         .build()) {
 *
 *     IngestResult result = linker.ingest(article);
 *     Optional&lt;Event&gt; event = linker.getEvent(result.getEventId());
 *
 *     BatchResult batch = linker.ingestBatch(articles);
 *     AnalyticsSnapshot weekly = linker.analytics(TimeGranularity.WEEK);
 *
 *     linker.startMaintenance(Duration.ofHours(1));
 * }
 * </pre>
 */
public class EventLinker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventLinker.class);

    private final LinkingOptions options;
    private final Clock clock;
    private final EventStore eventStore;
    private final ArticleRepository articleRepository;
    private final NearDuplicateDetector duplicateDetector;
    private final EventKeyBuilder keyBuilder;
    private final EventLinkingService service;
    private final EventLifecycleManager lifecycleManager;
    private final ReconciliationService reconciliationService;
    private final AnalyticsAggregator analyticsAggregator;
    private final AuditService auditService;
    private final MergeLedger mergeLedger;
    private final MetricsService metricsService;
    private final ExecutorService batchExecutor;
    private ScheduledExecutorService maintenanceExecutor;
    private ScheduledFuture<?> maintenanceTask;

    private EventLinker(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        this.eventStore = builder.eventStore != null ? builder.eventStore : new InMemoryEventStore();
        this.articleRepository = builder.articleRepository != null
                ? builder.articleRepository : new InMemoryArticleRepository();
        AuditRepository auditRepository = builder.auditRepository != null
                ? builder.auditRepository : new InMemoryAuditRepository();
        this.auditService = new AuditService(auditRepository, clock);
        this.mergeLedger = new MergeLedger();

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        ShardLock shardLock = builder.shardLock != null
                ? builder.shardLock : new LocalShardLock(builder.lockConfig);
        AnalyticsCache analyticsCache = builder.analyticsCache != null
                ? builder.analyticsCache
                : builder.cacheConfig.enabled() ? new CaffeineAnalyticsCache(builder.cacheConfig) : new NoOpAnalyticsCache();

        // Engines
        this.keyBuilder = new EventKeyBuilder(normalizationEngine);
        this.duplicateDetector = new NearDuplicateDetector(
                new TextFingerprinter(normalizationEngine, options.getDuplicateDetection()),
                options.getDuplicateDetection());
        EventSimilarityScorer scorer = new EventSimilarityScorer(new CosineSimilarity(normalizationEngine),
                options.getSimilarityWeights(), options.getMatchWindow().toDays());
        EventAggregation aggregation = new EventAggregation(new SeverityScorer(options.getSeverityWeights()),
                options.getMaxRepresentativeTexts());

        EventClusterer clusterer = new EventClusterer(eventStore, scorer, aggregation, options, metricsService, clock);
        EventMergeEngine mergeEngine = new EventMergeEngine(eventStore, articleRepository, aggregation, scorer,
                shardLock, mergeLedger, auditService, clock);
        this.lifecycleManager = new EventLifecycleManager(eventStore, shardLock, options, auditService,
                metricsService, clock);
        this.reconciliationService = new ReconciliationService(eventStore, scorer, mergeEngine, options,
                metricsService, clock);
        this.analyticsAggregator = new AnalyticsAggregator(eventStore, analyticsCache, metricsService);

        this.service = new EventLinkingService(eventStore, articleRepository, duplicateDetector, keyBuilder,
                clusterer, shardLock, auditService, options, metricsService, tracingService, clock);

        this.batchExecutor = Executors.newFixedThreadPool(options.getBatchParallelism(),
                namedThreadFactory("event-linking-batch"));

        log.info("EventLinker initialized with options: {}", options);
    }

    // ========== Ingestion API ==========

    /**
     * Ingests one article: duplicate detection, then assignment to an event.
     * Re-ingesting a known article id returns the earlier result with
     * {@link IngestResult#isAlreadyProcessed()} set.
     */
    public IngestResult ingest(ArticleRecord article) {
        return service.ingest(article);
    }

    /**
     * Ingests a batch. Articles are processed in publication order (then id). Sectors run
     * concurrently on the batch pool, each sector in order, since an article without a location
     * can join an event of any shard in its sector. A failing article is rolled back and
     * reported in {@link BatchResult#errors()}; the others proceed.
     *
     * @throws IllegalArgumentException if the batch is too large or contains an invalid article
     */
    public BatchResult ingestBatch(List<ArticleRecord> articles) {
        ArticleValidator.validateBatch(articles, options.getMaxBatchSize());
        metricsService.recordBatchSize(articles.size());

        List<ArticleRecord> ordered = new ArrayList<>(articles);
        ordered.sort(Comparator.comparing(ArticleRecord::getPublishedAt).thenComparing(ArticleRecord::getId));

        Map<String, List<Positioned>> bySector = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            ArticleRecord article = ordered.get(i);
            String sector = keyBuilder.normalizedSector(article.getAttributes()).orElse(EventKey.UNKNOWN);
            bySector.computeIfAbsent(sector, k -> new ArrayList<>()).add(new Positioned(i, article));
        }

        String batchId = UUID.randomUUID().toString();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            log.info("batch.starting batchId={} articles={} sectors={}", batchId, ordered.size(), bySector.size());

            List<Future<PartitionOutcome>> futures = new ArrayList<>();
            for (List<Positioned> partition : bySector.values()) {
                futures.add(batchExecutor.submit(() -> ingestPartition(batchId, partition)));
            }

            IngestResult[] byPosition = new IngestResult[ordered.size()];
            List<String> errors = new ArrayList<>();
            for (Future<PartitionOutcome> future : futures) {
                PartitionOutcome outcome = await(future);
                outcome.results().forEach((position, result) -> byPosition[position] = result);
                errors.addAll(outcome.errors());
            }

            List<IngestResult> results = new ArrayList<>();
            for (IngestResult result : byPosition) {
                if (result != null) {
                    results.add(result);
                }
            }

            BatchResult result = BatchResult.of(ordered.size(), results, errors);
            log.info("batch.completed batchId={} result={}", batchId, result);
            return result;
        }
    }

    private PartitionOutcome ingestPartition(String batchId, List<Positioned> partition) {
        Map<Integer, IngestResult> results = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            for (Positioned positioned : partition) {
                ArticleRecord article = positioned.article();
                try {
                    results.put(positioned.position(), service.ingest(article));
                } catch (RuntimeException e) {
                    errors.add(article.getId() + ": " + e.getMessage());
                    log.warn("batch.article.failed articleId={} error={}", article.getId(), e.getMessage());
                }
            }
        }
        return new PartitionOutcome(results, errors);
    }

    private static PartitionOutcome await(Future<PartitionOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch ingestion", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Batch ingestion failed", cause);
        }
    }

    private record Positioned(int position, ArticleRecord article) {
    }

    private record PartitionOutcome(Map<Integer, IngestResult> results, List<String> errors) {
    }

    // ========== Query API ==========

    public Optional<Event> getEvent(String eventId) {
        return eventStore.findById(eventId);
    }

    /**
     * All surviving events in creation order. Events absorbed by a merge are excluded.
     */
    public List<Event> getEvents() {
        return eventStore.findSurviving();
    }

    public List<Event> getEvents(EventState state) {
        return eventStore.findByState(state).stream()
                .filter(e -> !e.isAbsorbed())
                .toList();
    }

    /**
     * The surviving event an article belongs to; for a duplicate, the event of its canonical article.
     */
    public Optional<Event> getEventForArticle(String articleId) {
        return articleRepository.findAssignment(articleId).flatMap(service::currentEvent);
    }

    public Optional<ArticleAssignment> getAssignment(String articleId) {
        return articleRepository.findAssignment(articleId);
    }

    /**
     * Non-canonical article id to canonical article id, for every detected duplicate.
     */
    public Map<String, String> getDuplicateMapping() {
        return duplicateDetector.duplicateMapping();
    }

    public AnalyticsSnapshot analytics(TimeGranularity granularity) {
        return analyticsAggregator.snapshot(granularity);
    }

    // ========== Administration API ==========

    /**
     * Runs a reconciliation pass, merging events that describe the same action.
     */
    public ReconciliationResult reconcile() {
        return reconciliationService.reconcile();
    }

    public Event reopenEvent(String eventId, String operator) {
        return lifecycleManager.reopen(eventId, operator);
    }

    public Event finalizeEvent(String eventId, String operator) {
        return lifecycleManager.finalizeEvent(eventId, operator);
    }

    /**
     * Applies dormancy and closure as of the given instant.
     */
    public List<LifecycleTransition> advanceLifecycle(Instant asOf) {
        return lifecycleManager.advance(asOf);
    }

    public List<LifecycleTransition> advanceLifecycle() {
        return advanceLifecycle(clock.instant());
    }

    /**
     * Schedules a lifecycle sweep followed by a reconciliation pass at a fixed period.
     * Replaces any earlier schedule.
     */
    public synchronized void startMaintenance(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Maintenance period must be positive");
        }
        stopMaintenance();
        if (maintenanceExecutor == null) {
            maintenanceExecutor = Executors.newSingleThreadScheduledExecutor(
                    namedThreadFactory("event-linking-maintenance"));
        }
        long millis = period.toMillis();
        maintenanceTask = maintenanceExecutor.scheduleAtFixedRate(this::runMaintenance, millis, millis,
                TimeUnit.MILLISECONDS);
        log.info("maintenance.scheduled periodMs={}", millis);
    }

    public synchronized void stopMaintenance() {
        if (maintenanceTask != null) {
            maintenanceTask.cancel(false);
            maintenanceTask = null;
            log.info("maintenance.stopped");
        }
    }

    /**
     * One maintenance run. Failures are logged so the schedule keeps running.
     */
    void runMaintenance() {
        try {
            List<LifecycleTransition> transitions = advanceLifecycle();
            ReconciliationResult result = reconcile();
            log.info("maintenance.completed transitions={} merges={}", transitions.size(), result.mergeCount());
        } catch (RuntimeException e) {
            log.error("maintenance.failed error={}", e.getMessage(), e);
        }
    }

    // ========== Service Access ==========

    public EventLinkingService getService() {
        return service;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public LinkingOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        stopMaintenance();
        synchronized (this) {
            if (maintenanceExecutor != null) {
                maintenanceExecutor.shutdownNow();
            }
        }
        batchExecutor.shutdown();
        try {
            if (!batchExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                batchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            batchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("EventLinker closed");
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LinkingOptions options = LinkingOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private NormalizationEngine normalizationEngine;
        private EventStore eventStore;
        private ArticleRepository articleRepository;
        private AuditRepository auditRepository;
        private ShardLock shardLock;
        private LockConfig lockConfig = LockConfig.defaults();
        private AnalyticsCache analyticsCache;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder options(LinkingOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Clock for assignment timestamps, lifecycle sweeps and reopen. Defaults to UTC system time.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder articleRepository(ArticleRepository articleRepository) {
            this.articleRepository = articleRepository;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder shardLock(ShardLock shardLock) {
            this.shardLock = shardLock;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder analyticsCache(AnalyticsCache analyticsCache) {
            this.analyticsCache = analyticsCache;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public EventLinker build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            if (clock == null) {
                throw new IllegalStateException("clock is required");
            }
            return new EventLinker(this);
        }
    }
}
