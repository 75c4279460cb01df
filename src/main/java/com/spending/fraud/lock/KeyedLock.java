package com.spending.fraud.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion per logical key. Used to serialize check-then-act sequences such as
 * relationship upserts and duplicate alert suppression.
 */
public interface KeyedLock {

    /**
     * Acquires the lock for the given key, waiting up to the configured timeout.
     *
     * @param key the lock key
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock for the given key if held by the current thread.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Runs the action while holding the lock for the key.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
