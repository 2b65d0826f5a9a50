package com.event.linking.lock;

/**
 * Configuration for shard locks.
 *
 * @param timeoutMs    maximum time to wait for one acquisition attempt
 * @param maxRetries   additional attempts after a timed-out one
 * @param retryDelayMs delay between attempts in milliseconds
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, no retries, 100ms delay.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 0, 100);
    }
}
