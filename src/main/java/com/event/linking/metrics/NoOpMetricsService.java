package com.event.linking.metrics;

import com.event.linking.core.model.AssignmentOutcome;
import com.event.linking.core.model.EventState;

import java.time.Duration;

/**
 * No-op metrics implementation. Used when no registry is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIngestDuration(AssignmentOutcome outcome, Duration duration) {
    }

    @Override
    public void incrementDuplicateDetected(String matchKind) {
    }

    @Override
    public void incrementLowConfidence() {
    }

    @Override
    public void incrementStaleRetry() {
    }

    @Override
    public void incrementIngestFailure() {
    }

    @Override
    public void incrementLifecycleTransition(EventState from, EventState to) {
    }

    @Override
    public void incrementEventsMerged(int count) {
    }

    @Override
    public void recordReconciliationDuration(Duration duration) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
