package com.event.linking.lock;

/**
 * Lock that never blocks, for single-threaded ingestion and tests.
 */
public class NoOpShardLock implements ShardLock {

    @Override
    public void lock(String shardKey) {
        // nothing to acquire
    }

    @Override
    public void unlock(String shardKey) {
        // nothing to release
    }
}
