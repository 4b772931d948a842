package com.e2eq.aggregate.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read/write lock per aggregation root. A logical mutation (one execute batch, one event
 * reaction) holds the write lock of its root for its whole duration; lookups hold the read lock.
 * Locks are reentrant, so a reaction that triggers further events for the same root does not block.
 */
public final class RootLocks {

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final boolean fair;

    public RootLocks(boolean fair) {
        this.fair = fair;
    }

    private ReentrantReadWriteLock lockFor(String rootId) {
        return locks.computeIfAbsent(rootId, k -> new ReentrantReadWriteLock(fair));
    }

    public <T> T write(String rootId, Supplier<T> action) {
        return guarded(lockFor(rootId).writeLock(), action);
    }

    public <T> T read(String rootId, Supplier<T> action) {
        return guarded(lockFor(rootId).readLock(), action);
    }

    private static <T> T guarded(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
