package com.example.changefeed.lock;

import com.example.changefeed.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a held entity lock. Closing it releases the lock; closing twice
 * is harmless.
 */
@Slf4j
public final class EntityLease implements AutoCloseable {

    private final EntityKey key;
    private final EntityLock lock;
    private final long token;
    private final EntityLockRegistry registry;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    EntityLease(EntityKey key, EntityLock lock, long token, EntityLockRegistry registry) {
        this.key = key;
        this.lock = lock;
        this.token = token;
        this.registry = registry;
    }

    public EntityKey key() {
        return key;
    }

    public boolean isValid() {
        return !closed.get() && lock.isHeldBy(token);
    }

    /**
     * Guard to call right before committing work done under the lease.
     *
     * @throws LockTimeoutException if the lease expired and may have been taken over
     */
    public void verifyHeld() {
        if (!isValid()) {
            throw new LockTimeoutException(key.toString(), "Entity lease expired before commit");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!lock.release(token)) {
            log.warn("Lease on {} was taken over before release", key);
        }
        registry.unreference(key, lock);
    }
}
