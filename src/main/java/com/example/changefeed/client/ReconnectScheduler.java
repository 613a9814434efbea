package com.example.changefeed.client;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface ReconnectScheduler {

    void schedule(Duration delay, Runnable task);

    static ReconnectScheduler using(ScheduledExecutorService executor) {
        return (delay, task) -> executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
}
