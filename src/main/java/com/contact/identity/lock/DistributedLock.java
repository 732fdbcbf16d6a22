package com.contact.identity.lock;

/**
 * Lock keyed by a contact identifier, used to serialize concurrent
 * reconciliations that touch the same email or phone number.
 */
public interface DistributedLock {

    /**
     * Attempts to acquire a lock on the given key.
     *
     * @param key the lock key ({@code email:<value>} or {@code phone:<value>})
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key.
     *
     * @param key the lock key
     */
    void unlock(String key);
}
