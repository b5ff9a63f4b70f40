package com.pricemonitor.engine.domain.ingestion;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per product id. Serializes the read-latest, classify, append cycle of a product across
 * workers and across overlapping ingest runs in the same process.
 *
 * <p>A lock only lives while some thread holds or waits for it; the last one out removes it.
 */
public class ProductLockRegistry {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String productId, Supplier<T> work) throws InterruptedException {
        var entry = locks.compute(productId, (id, existing) -> {
            var held = existing != null ? existing : new Entry();
            held.users++;
            return held;
        });
        try {
            entry.lock.lockInterruptibly();
            try {
                return work.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(productId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    /** Number of products currently locked or waited on. */
    public int size() {
        return locks.size();
    }

    // users is only read and written inside compute calls for its key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
