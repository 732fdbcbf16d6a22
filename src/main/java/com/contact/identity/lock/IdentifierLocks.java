package com.contact.identity.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Holds the identifier locks of one reconciliation. Keys are acquired in
 * sorted order so two requests sharing identifiers cannot deadlock, and
 * released in reverse order on {@link #close()}.
 *
 * <pre>
 * try (IdentifierLocks held = IdentifierLocks.acquire(lock, email, phone)) {
 *     // reconcile
 * }
 * </pre>
 */
public final class IdentifierLocks implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentifierLocks.class);

    private final DistributedLock lock;
    private final Deque<String> held = new ArrayDeque<>();

    private IdentifierLocks(DistributedLock lock) {
        this.lock = lock;
    }

    public static IdentifierLocks acquire(DistributedLock lock, Optional<String> email, Optional<String> phoneNumber) {
        TreeSet<String> keys = new TreeSet<>();
        email.ifPresent(e -> keys.add(emailKey(e)));
        phoneNumber.ifPresent(p -> keys.add(phoneKey(p)));

        IdentifierLocks locks = new IdentifierLocks(lock);
        try {
            for (String key : keys) {
                lock.tryLock(key);
                locks.held.push(key);
            }
        } catch (RuntimeException e) {
            locks.close();
            throw e;
        }
        return locks;
    }

    public static String emailKey(String email) {
        return "email:" + email;
    }

    public static String phoneKey(String phoneNumber) {
        return "phone:" + phoneNumber;
    }

    /**
     * Number of keys currently held.
     */
    public int size() {
        return held.size();
    }

    @Override
    public void close() {
        while (!held.isEmpty()) {
            String key = held.pop();
            try {
                lock.unlock(key);
            } catch (RuntimeException e) {
                log.warn("Failed to release lock {}: {}", key, e.getMessage());
            }
        }
    }
}
