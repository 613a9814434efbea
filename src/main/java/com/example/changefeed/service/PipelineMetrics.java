package com.example.changefeed.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for the change pipeline. Poisoned jobs and dead
 * letters are the alerting signals.
 */
@Slf4j
@Service
public class PipelineMetrics {

    private final Counter jobsCommitted;
    private final Counter jobsDuplicate;
    private final Counter jobsRetried;
    private final Counter lockTimeouts;
    private final Counter jobsPoisoned;
    private final Counter deadLettered;
    private final Counter notificationsCreated;
    private final Counter deliveryFailures;
    private final Counter slowConsumers;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.jobsCommitted = meterRegistry.counter("pipeline.jobs.committed");
        this.jobsDuplicate = meterRegistry.counter("pipeline.jobs.duplicate");
        this.jobsRetried = meterRegistry.counter("pipeline.jobs.retried");
        this.lockTimeouts = meterRegistry.counter("pipeline.jobs.lock_timeouts");
        this.jobsPoisoned = meterRegistry.counter("pipeline.jobs.poisoned");
        this.deadLettered = meterRegistry.counter("pipeline.jobs.dead_lettered");
        this.notificationsCreated = meterRegistry.counter("notifications.created");
        this.deliveryFailures = meterRegistry.counter("notifications.delivery.failures");
        this.slowConsumers = meterRegistry.counter("notifications.delivery.slow_consumers");
    }

    public void recordCommitted() {
        jobsCommitted.increment();
    }

    public void recordDuplicate() {
        jobsDuplicate.increment();
    }

    public void recordRetry() {
        jobsRetried.increment();
    }

    public void recordLockTimeout() {
        lockTimeouts.increment();
    }

    public void recordPoisoned() {
        jobsPoisoned.increment();
        log.debug("Recorded poisoned job metric - Total: {}", jobsPoisoned.count());
    }

    public void recordDeadLetter() {
        deadLettered.increment();
    }

    public void recordNotificationsCreated(int count) {
        notificationsCreated.increment(count);
    }

    public void recordDeliveryFailure() {
        deliveryFailures.increment();
    }

    public void recordSlowConsumer() {
        slowConsumers.increment();
    }

    public double getPoisonedCount() {
        return jobsPoisoned.count();
    }

    public double getDeadLetterCount() {
        return deadLettered.count();
    }

    public double getRetryCount() {
        return jobsRetried.count();
    }

    public double getDeliveryFailureCount() {
        return deliveryFailures.count();
    }
}
