package com.example.changefeed.client;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Remembers recently seen notification ids, with the time each one arrived,
 * so that a notification arriving both live and through backfill is
 * surfaced once.
 */
public class NotificationDeduplicator {

    static final int DEFAULT_CAPACITY = 1000;

    private final Map<Long, Instant> seen;
    private long highestSeenId;
    private long highestEvictedId;

    public NotificationDeduplicator() {
        this(DEFAULT_CAPACITY);
    }

    public NotificationDeduplicator(int capacity) {
        this.seen = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Instant> eldest) {
                if (size() > capacity) {
                    highestEvictedId = Math.max(highestEvictedId, eldest.getKey());
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * @return true the first time an id is offered
     */
    public synchronized boolean firstSighting(long notificationId, Instant receivedAt) {
        if (seen.putIfAbsent(notificationId, receivedAt) != null) {
            return false;
        }
        highestSeenId = Math.max(highestSeenId, notificationId);
        return true;
    }

    public synchronized long highestSeenId() {
        return highestSeenId;
    }

    /**
     * Highest id received no later than {@code cutoff}. Ids are allocated
     * before the row commits, so every lower id had been allocated by then
     * and is committed once its transaction ends. Evicted ids count as
     * received before any cutoff.
     */
    public synchronized long settledWatermark(Instant cutoff) {
        long watermark = highestEvictedId;
        for (Map.Entry<Long, Instant> entry : seen.entrySet()) {
            if (!entry.getValue().isAfter(cutoff)) {
                watermark = Math.max(watermark, entry.getKey());
            }
        }
        return watermark;
    }
}
