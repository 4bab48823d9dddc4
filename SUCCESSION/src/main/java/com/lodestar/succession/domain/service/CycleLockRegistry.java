package com.lodestar.succession.domain.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Per-cycle read/write locks.
 * <p>
 * Stage-gated writes (candidacies, scores, slots, ballots) run under the read lock and may
 * proceed concurrently; transitions and cycle settings changes run under the write lock, so a
 * gated write never straddles a status change.
 */
@Component
public class CycleLockRegistry {

    private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    public <T> T withReadLock(String cycleId, Supplier<T> action) {
        return locked(lockFor(cycleId).readLock(), action);
    }

    public <T> T withWriteLock(String cycleId, Supplier<T> action) {
        return locked(lockFor(cycleId).writeLock(), action);
    }

    private ReentrantReadWriteLock lockFor(String cycleId) {
        return locks.computeIfAbsent(cycleId, id -> new ReentrantReadWriteLock(true));
    }

    private static <T> T locked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
