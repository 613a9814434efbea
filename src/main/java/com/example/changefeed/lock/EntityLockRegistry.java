package com.example.changefeed.lock;

import com.example.changefeed.exception.LockTimeoutException;
import com.example.changefeed.exception.RetryableJobException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arena of per-entity locks. Entries are created lazily on first use and
 * dropped once no lease holds or waits on them, so unrelated entities never
 * contend and the map stays bounded by the number of entities in flight.
 */
@Slf4j
@Component
public class EntityLockRegistry {

    private final ConcurrentMap<EntityKey, EntityLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong tokens = new AtomicLong();
    private final Duration leaseDuration;

    public EntityLockRegistry(@Value("${app.history.lock-lease:30s}") Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    /**
     * Blocks until the entity is free, at most {@code maxWait}.
     *
     * @throws LockTimeoutException if the lock is still held when the wait runs out
     */
    public EntityLease acquire(EntityKey key, Duration maxWait) {
        EntityLock lock = locks.compute(key, (k, existing) -> {
            EntityLock target = existing != null ? existing : new EntityLock(k);
            target.references++;
            return target;
        });
        long token = tokens.incrementAndGet();
        try {
            lock.acquire(token, maxWait.toNanos(), leaseDuration.toNanos());
            log.debug("Acquired entity lock {} with token {}", key, token);
            return new EntityLease(key, lock, token, this);
        } catch (InterruptedException e) {
            unreference(key, lock);
            Thread.currentThread().interrupt();
            throw new RetryableJobException("Interrupted while waiting for entity lock " + key, e);
        } catch (RuntimeException e) {
            unreference(key, lock);
            throw e;
        }
    }

    void unreference(EntityKey key, EntityLock lock) {
        locks.computeIfPresent(key, (k, current) -> {
            if (current != lock) {
                return current;
            }
            return --current.references == 0 ? null : current;
        });
    }

    /**
     * Number of entities currently locked or waited on.
     */
    public int activeEntities() {
        return locks.size();
    }
}
