package com.event.linking.api;

import com.event.linking.dedup.DuplicateDetectionConfig;
import com.event.linking.severity.SeverityWeights;
import com.event.linking.similarity.SimilarityWeights;

import java.time.Duration;

/**
 * Options for linking articles into events: thresholds, windows, weights and batch limits.
 */
public class LinkingOptions {

    private static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.55;
    private static final double DEFAULT_RECONCILIATION_THRESHOLD = 0.70;
    private static final double DEFAULT_LOW_CONFIDENCE_THRESHOLD = 0.5;
    private static final Duration DEFAULT_MATCH_WINDOW = Duration.ofDays(14);
    private static final Duration DEFAULT_DORMANCY_WINDOW = Duration.ofDays(14);
    private static final Duration DEFAULT_CLOSURE_WINDOW = Duration.ofDays(45);
    private static final Duration DEFAULT_CLOSED_MERGE_GRACE_PERIOD = Duration.ofDays(7);
    private static final Duration DEFAULT_MAX_RECONCILIATION_DURATION = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_ASSIGNMENT_RETRIES = 3;
    private static final int DEFAULT_MAX_REPRESENTATIVE_TEXTS = 5;
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;

    private final double acceptanceThreshold;
    private final double reconciliationThreshold;
    private final double lowConfidenceThreshold;
    private final SimilarityWeights similarityWeights;
    private final Duration matchWindow;
    private final Duration dormancyWindow;
    private final Duration closureWindow;
    private final Duration closedMergeGracePeriod;
    private final Duration maxReconciliationDuration;
    private final int maxAssignmentRetries;
    private final int maxRepresentativeTexts;
    private final int maxBatchSize;
    private final int batchParallelism;
    private final DuplicateDetectionConfig duplicateDetection;
    private final SeverityWeights severityWeights;

    private LinkingOptions(Builder builder) {
        this.acceptanceThreshold = builder.acceptanceThreshold;
        this.reconciliationThreshold = builder.reconciliationThreshold;
        this.lowConfidenceThreshold = builder.lowConfidenceThreshold;
        this.similarityWeights = builder.similarityWeights;
        this.matchWindow = builder.matchWindow;
        this.dormancyWindow = builder.dormancyWindow;
        this.closureWindow = builder.closureWindow;
        this.closedMergeGracePeriod = builder.closedMergeGracePeriod;
        this.maxReconciliationDuration = builder.maxReconciliationDuration;
        this.maxAssignmentRetries = builder.maxAssignmentRetries;
        this.maxRepresentativeTexts = builder.maxRepresentativeTexts;
        this.maxBatchSize = builder.maxBatchSize;
        this.batchParallelism = builder.batchParallelism;
        this.duplicateDetection = builder.duplicateDetection;
        this.severityWeights = builder.severityWeights;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public double getReconciliationThreshold() {
        return reconciliationThreshold;
    }

    public double getLowConfidenceThreshold() {
        return lowConfidenceThreshold;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public Duration getMatchWindow() {
        return matchWindow;
    }

    public Duration getDormancyWindow() {
        return dormancyWindow;
    }

    public Duration getClosureWindow() {
        return closureWindow;
    }

    public Duration getClosedMergeGracePeriod() {
        return closedMergeGracePeriod;
    }

    public Duration getMaxReconciliationDuration() {
        return maxReconciliationDuration;
    }

    public int getMaxAssignmentRetries() {
        return maxAssignmentRetries;
    }

    public int getMaxRepresentativeTexts() {
        return maxRepresentativeTexts;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public DuplicateDetectionConfig getDuplicateDetection() {
        return duplicateDetection;
    }

    public SeverityWeights getSeverityWeights() {
        return severityWeights;
    }

    public static LinkingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(LinkingOptions options) {
        return new Builder()
                .acceptanceThreshold(options.acceptanceThreshold)
                .reconciliationThreshold(options.reconciliationThreshold)
                .lowConfidenceThreshold(options.lowConfidenceThreshold)
                .similarityWeights(options.similarityWeights)
                .matchWindow(options.matchWindow)
                .dormancyWindow(options.dormancyWindow)
                .closureWindow(options.closureWindow)
                .closedMergeGracePeriod(options.closedMergeGracePeriod)
                .maxReconciliationDuration(options.maxReconciliationDuration)
                .maxAssignmentRetries(options.maxAssignmentRetries)
                .maxRepresentativeTexts(options.maxRepresentativeTexts)
                .maxBatchSize(options.maxBatchSize)
                .batchParallelism(options.batchParallelism)
                .duplicateDetection(options.duplicateDetection)
                .severityWeights(options.severityWeights);
    }

    public static class Builder {
        private double acceptanceThreshold = DEFAULT_ACCEPTANCE_THRESHOLD;
        private double reconciliationThreshold = DEFAULT_RECONCILIATION_THRESHOLD;
        private double lowConfidenceThreshold = DEFAULT_LOW_CONFIDENCE_THRESHOLD;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private Duration matchWindow = DEFAULT_MATCH_WINDOW;
        private Duration dormancyWindow = DEFAULT_DORMANCY_WINDOW;
        private Duration closureWindow = DEFAULT_CLOSURE_WINDOW;
        private Duration closedMergeGracePeriod = DEFAULT_CLOSED_MERGE_GRACE_PERIOD;
        private Duration maxReconciliationDuration = DEFAULT_MAX_RECONCILIATION_DURATION;
        private int maxAssignmentRetries = DEFAULT_MAX_ASSIGNMENT_RETRIES;
        private int maxRepresentativeTexts = DEFAULT_MAX_REPRESENTATIVE_TEXTS;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private int batchParallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
        private DuplicateDetectionConfig duplicateDetection = DuplicateDetectionConfig.defaults();
        private SeverityWeights severityWeights = SeverityWeights.defaults();

        public Builder acceptanceThreshold(double acceptanceThreshold) {
            validateThreshold(acceptanceThreshold, "acceptanceThreshold");
            this.acceptanceThreshold = acceptanceThreshold;
            return this;
        }

        public Builder reconciliationThreshold(double reconciliationThreshold) {
            validateThreshold(reconciliationThreshold, "reconciliationThreshold");
            this.reconciliationThreshold = reconciliationThreshold;
            return this;
        }

        public Builder lowConfidenceThreshold(double lowConfidenceThreshold) {
            validateThreshold(lowConfidenceThreshold, "lowConfidenceThreshold");
            this.lowConfidenceThreshold = lowConfidenceThreshold;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            if (similarityWeights == null) {
                throw new IllegalArgumentException("similarityWeights is required");
            }
            this.similarityWeights = similarityWeights;
            return this;
        }

        public Builder matchWindow(Duration matchWindow) {
            validatePositive(matchWindow, "matchWindow");
            this.matchWindow = matchWindow;
            return this;
        }

        public Builder dormancyWindow(Duration dormancyWindow) {
            validatePositive(dormancyWindow, "dormancyWindow");
            this.dormancyWindow = dormancyWindow;
            return this;
        }

        public Builder closureWindow(Duration closureWindow) {
            validatePositive(closureWindow, "closureWindow");
            this.closureWindow = closureWindow;
            return this;
        }

        public Builder closedMergeGracePeriod(Duration closedMergeGracePeriod) {
            if (closedMergeGracePeriod == null || closedMergeGracePeriod.isNegative()) {
                throw new IllegalArgumentException("closedMergeGracePeriod must be non-negative");
            }
            this.closedMergeGracePeriod = closedMergeGracePeriod;
            return this;
        }

        public Builder maxReconciliationDuration(Duration maxReconciliationDuration) {
            validatePositive(maxReconciliationDuration, "maxReconciliationDuration");
            this.maxReconciliationDuration = maxReconciliationDuration;
            return this;
        }

        public Builder maxAssignmentRetries(int maxAssignmentRetries) {
            if (maxAssignmentRetries < 0) {
                throw new IllegalArgumentException("maxAssignmentRetries must be >= 0");
            }
            this.maxAssignmentRetries = maxAssignmentRetries;
            return this;
        }

        public Builder maxRepresentativeTexts(int maxRepresentativeTexts) {
            if (maxRepresentativeTexts <= 0) {
                throw new IllegalArgumentException("maxRepresentativeTexts must be positive");
            }
            this.maxRepresentativeTexts = maxRepresentativeTexts;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder batchParallelism(int batchParallelism) {
            if (batchParallelism <= 0) {
                throw new IllegalArgumentException("batchParallelism must be positive");
            }
            this.batchParallelism = batchParallelism;
            return this;
        }

        public Builder duplicateDetection(DuplicateDetectionConfig duplicateDetection) {
            if (duplicateDetection == null) {
                throw new IllegalArgumentException("duplicateDetection is required");
            }
            this.duplicateDetection = duplicateDetection;
            return this;
        }

        public Builder severityWeights(SeverityWeights severityWeights) {
            if (severityWeights == null) {
                throw new IllegalArgumentException("severityWeights is required");
            }
            this.severityWeights = severityWeights;
            return this;
        }

        public LinkingOptions build() {
            if (closureWindow.compareTo(dormancyWindow) <= 0) {
                throw new IllegalArgumentException("closureWindow must be longer than dormancyWindow");
            }
            return new LinkingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private void validatePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }
    }

    @Override
    public String toString() {
        return "LinkingOptions{" +
                "acceptanceThreshold=" + acceptanceThreshold +
                ", reconciliationThreshold=" + reconciliationThreshold +
                ", lowConfidenceThreshold=" + lowConfidenceThreshold +
                ", weights=" + similarityWeights +
                ", matchWindow=" + matchWindow +
                ", dormancyWindow=" + dormancyWindow +
                ", closureWindow=" + closureWindow +
                ", closedMergeGracePeriod=" + closedMergeGracePeriod +
                ", maxReconciliationDuration=" + maxReconciliationDuration +
                ", maxAssignmentRetries=" + maxAssignmentRetries +
                ", maxBatchSize=" + maxBatchSize +
                ", batchParallelism=" + batchParallelism +
                '}';
    }
}
