package com.example.changefeed.lock;

import com.example.changefeed.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lease-based lock for a single entity. Ownership is identified by a token
 * rather than by thread, which lets a waiter take over a lease whose holder
 * overran its deadline.
 */
@Slf4j
final class EntityLock {

    private final EntityKey key;
    private final ReentrantLock mutex = new ReentrantLock(true);
    private final Condition released = mutex.newCondition();

    private long ownerToken;          // 0 when free
    private long leaseDeadlineNanos;

    /** Guarded by the registry map's per-key compute. */
    int references;

    EntityLock(EntityKey key) {
        this.key = key;
    }

    long acquire(long token, long waitNanos, long leaseNanos) throws InterruptedException {
        mutex.lockInterruptibly();
        try {
            long deadline = System.nanoTime() + waitNanos;
            while (ownerToken != 0) {
                long now = System.nanoTime();
                if (now - leaseDeadlineNanos >= 0) {
                    log.warn("Force-releasing expired lease on {} held by token {}", key, ownerToken);
                    ownerToken = 0;
                    break;
                }
                long remaining = deadline - now;
                if (remaining <= 0) {
                    throw new LockTimeoutException(key.toString(),
                            "Timed out after " + TimeUnit.NANOSECONDS.toMillis(waitNanos) + " ms waiting for entity lock");
                }
                released.awaitNanos(Math.min(remaining, leaseDeadlineNanos - now));
            }
            ownerToken = token;
            leaseDeadlineNanos = System.nanoTime() + leaseNanos;
            return leaseDeadlineNanos;
        } finally {
            mutex.unlock();
        }
    }

    boolean isHeldBy(long token) {
        mutex.lock();
        try {
            return ownerToken == token && System.nanoTime() - leaseDeadlineNanos < 0;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * @return false if the lease had already been taken over
     */
    boolean release(long token) {
        mutex.lock();
        try {
            if (ownerToken != token) {
                return false;
            }
            ownerToken = 0;
            released.signal();
            return true;
        } finally {
            mutex.unlock();
        }
    }
}
