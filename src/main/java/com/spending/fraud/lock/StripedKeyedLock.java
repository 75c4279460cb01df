package com.spending.fraud.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock backed by a fixed array of {@link ReentrantLock} stripes.
 * Keys hashing to the same stripe share a lock, so memory stays bounded however many
 * keys are seen. Locks are reentrant, so nested use with colliding keys is safe.
 */
public class StripedKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(StripedKeyedLock.class);

    private final ReentrantLock[] stripes;
    private final LockConfig config;

    public StripedKeyedLock() {
        this(LockConfig.defaults());
    }

    public StripedKeyedLock(LockConfig config) {
        this.config = config;
        this.stripes = new ReentrantLock[config.stripes()];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = stripeFor(key);
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = stripeFor(key);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("Lock released: {}", key);
        }
    }

    private ReentrantLock stripeFor(String key) {
        return stripes[Math.floorMod(key.hashCode(), stripes.length)];
    }
}
