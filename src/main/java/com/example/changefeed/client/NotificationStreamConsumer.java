package com.example.changefeed.client;

import com.example.changefeed.model.dto.NotificationView;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Client side of the live notification stream.
 *
 * Keeps one connection open, reconnecting with exponential backoff after
 * every drop. Each open that follows an earlier open first backfills what
 * was created while disconnected, page by page until the server has nothing
 * newer. Backfill restarts from the highest id received at least one settle
 * window before the drop, so a lower id whose transaction was still open at
 * that point is fetched too. Every notification reaches the listener once,
 * whether it came live or through backfill. Payloads that fail validation
 * are dropped without closing the connection.
 */
@Slf4j
public class NotificationStreamConsumer {

    static final Duration DEFAULT_SETTLE_WINDOW = Duration.ofSeconds(10);

    private final NotificationStreamTransport transport;
    private final NotificationBackfill backfill;
    private final ReconnectScheduler scheduler;
    private final NotificationPayloadParser parser;
    private final Consumer<NotificationView> listener;
    private final ReconnectBackoff backoff;
    private final NotificationDeduplicator deduplicator;
    private final Clock clock;
    private final Duration settleWindow;
    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.IDLE);
    private volatile boolean openedBefore;
    private volatile Instant disconnectedAt;

    public NotificationStreamConsumer(NotificationStreamTransport transport,
                                      NotificationBackfill backfill,
                                      ReconnectScheduler scheduler,
                                      NotificationPayloadParser parser,
                                      Consumer<NotificationView> listener) {
        this(transport, backfill, scheduler, parser, listener, new ReconnectBackoff(), new NotificationDeduplicator(),
                Clock.systemUTC(), DEFAULT_SETTLE_WINDOW);
    }

    public NotificationStreamConsumer(NotificationStreamTransport transport,
                                      NotificationBackfill backfill,
                                      ReconnectScheduler scheduler,
                                      NotificationPayloadParser parser,
                                      Consumer<NotificationView> listener,
                                      ReconnectBackoff backoff,
                                      NotificationDeduplicator deduplicator,
                                      Clock clock,
                                      Duration settleWindow) {
        this.transport = transport;
        this.backfill = backfill;
        this.scheduler = scheduler;
        this.parser = parser;
        this.listener = listener;
        this.backoff = backoff;
        this.deduplicator = deduplicator;
        this.clock = clock;
        this.settleWindow = settleWindow;
    }

    public void start() {
        if (state.compareAndSet(StreamState.IDLE, StreamState.CONNECTING)) {
            scheduler.schedule(Duration.ZERO, this::connect);
        }
    }

    public void stop() {
        StreamState previous = state.getAndSet(StreamState.STOPPED);
        if (previous != StreamState.STOPPED) {
            transport.abort();
            log.info("Notification stream stopped");
        }
    }

    public StreamState getState() {
        return state.get();
    }

    public long getLastSeenId() {
        return deduplicator.highestSeenId();
    }

    void connect() {
        if (!moveTo(StreamState.CONNECTING)) {
            return;
        }
        try {
            transport.stream(new StreamHandler() {
                @Override
                public void onOpen() {
                    opened();
                }

                @Override
                public void onEvent(String data) {
                    parser.parse(data).ifPresent(NotificationStreamConsumer.this::accept);
                }
            });
            log.info("Notification stream closed by server");
        } catch (RuntimeException e) {
            log.warn("Notification stream failed: {}", e.getMessage());
        }
        disconnectedAt = clock.instant();
        scheduleReconnect();
    }

    private void opened() {
        if (!moveTo(StreamState.OPEN)) {
            return;
        }
        backoff.reset();
        if (openedBefore) {
            backfillSince(deduplicator.settledWatermark(disconnectedAt.minus(settleWindow)));
        }
        openedBefore = true;
    }

    private void backfillSince(long watermark) {
        long since = watermark;
        int fetched = 0;
        while (state.get() == StreamState.OPEN) {
            List<NotificationView> page = backfill.fetchSince(since);
            if (page.isEmpty()) {
                break;
            }
            page.forEach(this::accept);
            fetched += page.size();
            long pageHighest = page.stream().mapToLong(NotificationView::id).max().orElse(since);
            if (pageHighest <= since) {
                log.warn("Backfill since {} returned no newer ids, stopping", since);
                break;
            }
            since = pageHighest;
        }
        log.info("Reconnected, backfilled {} notification(s) since {}", fetched, watermark);
    }

    private synchronized void accept(NotificationView notification) {
        if (deduplicator.firstSighting(notification.id(), clock.instant())) {
            listener.accept(notification);
        } else {
            log.debug("Skipping duplicate notification {}", notification.id());
        }
    }

    private void scheduleReconnect() {
        if (!moveTo(StreamState.BACKOFF)) {
            return;
        }
        Duration delay = backoff.nextDelay();
        log.info("Reconnecting notification stream in {} ms (attempt {})",
                delay.toMillis(), backoff.getConsecutiveFailures());
        scheduler.schedule(delay, this::connect);
    }

    /**
     * Moves to {@code target} unless the consumer has been stopped.
     */
    private boolean moveTo(StreamState target) {
        StreamState current = state.get();
        while (current != StreamState.STOPPED) {
            if (current == target || state.compareAndSet(current, target)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }
}
