package com.event.linking.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process shard lock using one {@link ReentrantLock} per shard key.
 * This is the default lock implementation.
 */
public class LocalShardLock implements ShardLock {
    private static final Logger log = LoggerFactory.getLogger(LocalShardLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalShardLock() {
        this(LockConfig.defaults());
    }

    public LocalShardLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String shardKey) {
        ReentrantLock lock = locks.computeIfAbsent(shardKey, k -> new ReentrantLock());
        try {
            for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
                if (attempt > 0) {
                    log.debug("lock.retry shard={} attempt={}", shardKey, attempt);
                    Thread.sleep(config.retryDelayMs());
                }
                if (lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.debug("lock.acquired shard={}", shardKey);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for shard: " + shardKey, e);
        }
        throw new LockAcquisitionException("Failed to acquire lock for shard '" + shardKey + "' within "
                + config.timeoutMs() + "ms after " + (config.maxRetries() + 1) + " attempt(s)");
    }

    @Override
    public void unlock(String shardKey) {
        ReentrantLock lock = locks.get(shardKey);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released shard={}", shardKey);
        }
    }

    /**
     * Whether the current thread holds the shard lock.
     */
    public boolean isHeldByCurrentThread(String shardKey) {
        ReentrantLock lock = locks.get(shardKey);
        return lock != null && lock.isHeldByCurrentThread();
    }
}
