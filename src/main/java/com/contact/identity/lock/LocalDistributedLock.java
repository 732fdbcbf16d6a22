package com.contact.identity.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process identifier lock: one fair {@link ReentrantLock} per key, covering a
 * single JVM. This is the default lock implementation.
 *
 * <p>Keys are contact identifiers, so the key space is unbounded. Each entry
 * counts the threads holding or waiting for it and is dropped when the count
 * reaches zero.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        KeyLock entry = locks.compute(key, (k, existing) -> {
            KeyLock e = existing != null ? existing : new KeyLock();
            e.users++;
            return e;
        });
        boolean acquired;
        try {
            acquired = entry.lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            release(key);
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for identifier lock " + key, e);
        }
        if (!acquired) {
            release(key);
            throw new LockAcquisitionException(
                    "Identifier lock " + key + " not acquired within " + config.timeoutMs() + "ms");
        }
        log.trace("identifier.lock.acquired key={}", key);
        return true;
    }

    @Override
    public void unlock(String key) {
        KeyLock entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            return;
        }
        entry.lock.unlock();
        release(key);
        log.trace("identifier.lock.released key={}", key);
    }

    /**
     * Number of keys currently held or waited for.
     */
    public int activeKeys() {
        return locks.size();
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    private static final class KeyLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the map's per-key compute
        private int users;
    }
}
