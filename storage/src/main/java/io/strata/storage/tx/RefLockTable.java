// file: storage/src/main/java/io/strata/storage/tx/RefLockTable.java
package io.strata.storage.tx;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per reference name, shared by every transaction and by recovery.
 * <p>
 * Locks are always taken in sorted name order, so two callers with overlapping
 * reference sets cannot deadlock; the bounded wait covers everything else.
 */
public final class RefLockTable {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Lock every reference in {@code refs}, waiting at most {@code timeout} in total.
     *
     * @return the held locks, or empty if the wait expired (nothing is left locked)
     */
    public Optional<Held> tryLockAll(Collection<String> refs, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        var held = new ArrayList<ReentrantLock>(refs.size());
        for (String ref : new TreeSet<>(refs)) {
            ReentrantLock lock = locks.computeIfAbsent(ref, r -> new ReentrantLock());
            boolean acquired;
            try {
                acquired = lock.tryLock(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                acquired = false;
            }
            if (!acquired) {
                new Held(held).close();
                return Optional.empty();
            }
            held.add(lock);
        }
        return Optional.of(new Held(held));
    }

    /** Locks held by the calling thread; released in reverse order on close. */
    public static final class Held implements AutoCloseable {
        private final List<ReentrantLock> locks;

        private Held(List<ReentrantLock> locks) {
            this.locks = locks;
        }

        @Override
        public void close() {
            for (int i = locks.size() - 1; i >= 0; i--) {
                locks.get(i).unlock();
            }
            locks.clear();
        }
    }
}
