package io.syncmesh.util;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped lock table: every key maps to one of a fixed number of locks, so writers
 * to the same key on this node run one at a time.
 */
public final class KeyedLocks {
    private final ReentrantLock[] stripes;

    public KeyedLocks(int stripeCount) {
        int count = Math.max(1, stripeCount);
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = stripeFor(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        return stripes[Math.floorMod(hash ^ (hash >>> 16), stripes.length)];
    }
}
