package com.example.changefeed.client;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Reconnect delays: starts at the base delay, doubles per consecutive
 * failure and is capped; {@link #reset()} after a successful open.
 * With the defaults the sequence is 1, 2, 4, 8, 16, 30, 30 ... seconds.
 */
public class ReconnectBackoff {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CAP = Duration.ofSeconds(30);

    private final IntervalFunction intervals;
    private int consecutiveFailures;

    public ReconnectBackoff() {
        this(DEFAULT_BASE, DEFAULT_CAP);
    }

    public ReconnectBackoff(Duration base, Duration cap) {
        this.intervals = IntervalFunction.ofExponentialBackoff(base, 2.0, cap);
    }

    public synchronized Duration nextDelay() {
        consecutiveFailures++;
        return Duration.ofMillis(intervals.apply(consecutiveFailures));
    }

    public synchronized void reset() {
        consecutiveFailures = 0;
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
