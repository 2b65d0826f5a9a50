package com.event.linking.lock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Serializes event assignment within a shard ({@code sector|location}).
 * Articles of different shards are assigned concurrently.
 */
public interface ShardLock {

    /**
     * Acquires the lock on the given shard.
     *
     * @param shardKey the shard key
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured timeout
     */
    void lock(String shardKey);

    /**
     * Releases a lock held by the current thread.
     */
    void unlock(String shardKey);

    /**
     * Locks several shards in sorted key order, so that two callers locking overlapping sets
     * never deadlock. Closing the handle releases them in reverse order.
     */
    default Handle lockAll(Collection<String> shardKeys) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(shardKeys));
        List<String> acquired = new ArrayList<>(ordered.size());
        try {
            for (String key : ordered) {
                lock(key);
                acquired.add(key);
            }
        } catch (RuntimeException e) {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                unlock(acquired.get(i));
            }
            throw e;
        }
        return () -> {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                unlock(acquired.get(i));
            }
        };
    }

    /**
     * Releases the shards acquired by {@link #lockAll(Collection)}.
     */
    interface Handle extends AutoCloseable {
        @Override
        void close();
    }
}
