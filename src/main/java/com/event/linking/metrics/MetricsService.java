package com.event.linking.metrics;

import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.EventState;

import java.time.Duration;

/**
 * Interface for recording event linking metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordIngestDuration(AssignmentOutcome outcome, Duration duration);

    void incrementDuplicateDetected(String matchKind);

    void incrementLowConfidence();

    void incrementStaleRetry();

    void incrementIngestFailure();

    void incrementLifecycleTransition(EventState from, EventState to);

    void incrementEventsMerged(int count);

    void recordReconciliationDuration(Duration duration);

    void recordMatchScore(double score);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
