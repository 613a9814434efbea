package com.example.changefeed.queue.memory;

import com.example.changefeed.exception.LockTimeoutException;
import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.queue.ChangeJobHandler;
import com.example.changefeed.queue.ChangeJobQueue;
import com.example.changefeed.queue.DeadLetterStore;
import com.example.changefeed.service.PipelineMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local change job queue for local runs and tests.
 *
 * Each entity has its own FIFO lane. A lane hands out its head job to one
 * worker at a time; later jobs of that entity wait until the head is
 * completed or dead-lettered. A failed head stays at the front and becomes
 * visible again after a backoff delay. A worker that holds a job longer than
 * the visibility timeout loses it: the job is handed out again and the late
 * completion is ignored.
 *
 * Jobs are not persisted; a process restart drops them.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.type", havingValue = "in-memory")
public class InMemoryChangeJobQueue implements ChangeJobQueue {

    private final ChangeJobHandler handler;
    private final DeadLetterStore deadLetterStore;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;
    private final int workers;
    private final int maxAttempts;
    private final long visibilityTimeoutNanos;
    private final IntervalFunction backoff;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Lane> lanes = new LinkedHashMap<>();
    private long deliverySequence;
    private volatile boolean running;
    private ExecutorService workerPool;

    public InMemoryChangeJobQueue(ChangeJobHandler handler,
                                  DeadLetterStore deadLetterStore,
                                  PipelineMetrics metrics,
                                  ObjectMapper objectMapper,
                                  @Value("${app.queue.workers:5}") int workers,
                                  @Value("${app.queue.max-attempts:5}") int maxAttempts,
                                  @Value("${app.queue.visibility-timeout:60s}") Duration visibilityTimeout,
                                  @Value("${app.queue.retry.initial-interval:1s}") Duration initialInterval,
                                  @Value("${app.queue.retry.multiplier:2.0}") double multiplier,
                                  @Value("${app.queue.retry.max-interval:30s}") Duration maxInterval) {
        this.handler = handler;
        this.deadLetterStore = deadLetterStore;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.workers = workers;
        this.maxAttempts = maxAttempts;
        this.visibilityTimeoutNanos = visibilityTimeout.toNanos();
        this.backoff = IntervalFunction.ofExponentialBackoff(initialInterval, multiplier, maxInterval);
    }

    @PostConstruct
    public void start() {
        running = true;
        AtomicInteger counter = new AtomicInteger();
        workerPool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "change-job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workers; i++) {
            workerPool.execute(this::workLoop);
        }
        log.info("In-memory change job queue started with {} worker(s)", workers);
    }

    @PreDestroy
    public void stop() {
        running = false;
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("In-memory change job queue stopped, {} job(s) left", pendingJobs());
    }

    @Override
    public void enqueue(ChangeEvent event) {
        lock.lock();
        try {
            lanes.computeIfAbsent(event.entityKey(), Lane::new).jobs.addLast(new Job(event));
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until every enqueued job has been completed or dead-lettered.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!lanes.isEmpty()) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int pendingJobs() {
        lock.lock();
        try {
            return lanes.values().stream().mapToInt(lane -> lane.jobs.size()).sum();
        } finally {
            lock.unlock();
        }
    }

    private void workLoop() {
        while (running) {
            Delivery delivery;
            try {
                delivery = take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery != null) {
                execute(delivery);
            }
        }
    }

    /**
     * Waits for a lane whose head is free and visible, marks it in flight and
     * returns it. Returns null when the queue is stopping.
     */
    private Delivery take() throws InterruptedException {
        lock.lock();
        try {
            while (running) {
                long now = System.nanoTime();
                long nextWakeUp = Long.MAX_VALUE;
                for (Lane lane : lanes.values()) {
                    if (lane.inFlight && !lane.deadLettering && now - lane.visibleUntilNanos >= 0) {
                        log.warn("Job {} dedupKey={} exceeded its visibility timeout, redelivering",
                                lane.key, lane.jobs.peekFirst().event.dedupKey());
                        lane.inFlight = false;
                    }
                    if (lane.inFlight) {
                        if (!lane.deadLettering) {
                            nextWakeUp = Math.min(nextWakeUp, lane.visibleUntilNanos - now);
                        }
                        continue;
                    }
                    long wait = lane.notBeforeNanos - now;
                    if (wait > 0) {
                        nextWakeUp = Math.min(nextWakeUp, wait);
                        continue;
                    }
                    Job job = lane.jobs.peekFirst();
                    job.attempts++;
                    lane.inFlight = true;
                    lane.visibleUntilNanos = now + visibilityTimeoutNanos;
                    lane.deliveryToken = ++deliverySequence;
                    return new Delivery(lane, job, lane.deliveryToken);
                }
                if (nextWakeUp == Long.MAX_VALUE) {
                    changed.await();
                } else {
                    changed.awaitNanos(nextWakeUp);
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void execute(Delivery delivery) {
        ChangeEvent event = delivery.job.event;
        try {
            handler.handle(event);
            complete(delivery);
        } catch (PoisonedJobException e) {
            fail(delivery, e, true);
        } catch (RuntimeException e) {
            if (e instanceof LockTimeoutException) {
                metrics.recordLockTimeout();
            }
            fail(delivery, e, false);
        }
    }

    private void complete(Delivery delivery) {
        lock.lock();
        try {
            if (!owns(delivery)) {
                log.warn("Ignoring late completion of {} dedupKey={}",
                        delivery.lane.key, delivery.job.event.dedupKey());
                return;
            }
            removeHead(delivery.lane);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Schedules a retry, or dead-letters once the job is poisoned or out of
     * attempts. A delivery that lost its lane to a redelivery changes nothing.
     */
    private void fail(Delivery delivery, RuntimeException error, boolean poisoned) {
        int attempts;
        lock.lock();
        try {
            if (!owns(delivery)) {
                log.warn("Ignoring late failure of {} dedupKey={}: {}",
                        delivery.lane.key, delivery.job.event.dedupKey(), error.getMessage());
                return;
            }
            attempts = delivery.job.attempts;
            if (!poisoned && attempts < maxAttempts) {
                long delayMillis = backoff.apply(attempts);
                Lane lane = delivery.lane;
                lane.inFlight = false;
                lane.notBeforeNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMillis);
                metrics.recordRetry();
                log.warn("Attempt {} of job {} dedupKey={} failed, retrying in {} ms: {}",
                        attempts, lane.key, delivery.job.event.dedupKey(), delayMillis, error.getMessage());
                changed.signalAll();
                return;
            }
            // pinned in flight past its visibility timeout until the dead letter is stored
            delivery.lane.deadLettering = true;
        } finally {
            lock.unlock();
        }
        deadLetter(delivery, error, attempts, poisoned);
    }

    private void deadLetter(Delivery delivery, RuntimeException error, int attempts, boolean poisoned) {
        try {
            deadLetterStore.deadLetter(delivery.lane.key, toJson(delivery.job.event),
                    error.getMessage(), attempts, poisoned);
        } catch (RuntimeException storeFailure) {
            log.error("Could not dead-letter {} dedupKey={}, will redeliver",
                    delivery.lane.key, delivery.job.event.dedupKey(), storeFailure);
            lock.lock();
            try {
                delivery.lane.deadLettering = false;
                if (owns(delivery)) {
                    delivery.lane.inFlight = false;
                    delivery.lane.notBeforeNanos = System.nanoTime()
                            + TimeUnit.MILLISECONDS.toNanos(backoff.apply(attempts));
                }
                changed.signalAll();
            } finally {
                lock.unlock();
            }
            return;
        }
        lock.lock();
        try {
            delivery.lane.deadLettering = false;
            if (owns(delivery)) {
                removeHead(delivery.lane);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean owns(Delivery delivery) {
        return delivery.lane.inFlight
                && delivery.lane.deliveryToken == delivery.token
                && lanes.get(delivery.lane.key) == delivery.lane;
    }

    private void removeHead(Lane lane) {
        lane.jobs.pollFirst();
        lane.inFlight = false;
        lane.notBeforeNanos = 0L;
        if (lane.jobs.isEmpty()) {
            lanes.remove(lane.key);
        }
        changed.signalAll();
    }

    private String toJson(ChangeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize dead-lettered event {}: {}", event.dedupKey(), e.getOriginalMessage());
            return String.valueOf(event);
        }
    }

    private static final class Lane {
        final String key;
        final Deque<Job> jobs = new ArrayDeque<>();
        boolean inFlight;
        boolean deadLettering;
        long visibleUntilNanos;
        long notBeforeNanos;
        long deliveryToken;

        Lane(String key) {
            this.key = key;
        }
    }

    private static final class Job {
        final ChangeEvent event;
        int attempts;

        Job(ChangeEvent event) {
            this.event = event;
        }
    }

    private record Delivery(Lane lane, Job job, long token) {
    }
}
