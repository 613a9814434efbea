package com.example.changefeed.service.fanout;

import com.example.changefeed.exception.DeliveryFailureException;
import com.example.changefeed.model.dto.NotificationView;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One open live connection of a user.
 *
 * Pushes go through a bounded buffer drained by at most one sender at a time,
 * so a channel delivers in the order notifications were offered. A full
 * buffer means the client does not keep up; the channel is closed with error
 * and the client recovers through backfill.
 */
@Slf4j
public class LiveChannel {

    private final String id = UUID.randomUUID().toString();
    private final Long userId;
    private final ChannelSink sink;
    private final BlockingQueue<Push> buffer;
    private final Executor sender;
    private final Consumer<LiveChannel> onClosed;
    private final AtomicReference<ChannelState> state = new AtomicReference<>(ChannelState.CONNECTING);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private volatile long lastDeliveredNotificationId;
    private volatile Throwable failure;

    LiveChannel(Long userId, ChannelSink sink, int bufferCapacity, Executor sender,
                Consumer<LiveChannel> onClosed) {
        this.userId = userId;
        this.sink = sink;
        this.buffer = new ArrayBlockingQueue<>(bufferCapacity);
        this.sender = sender;
        this.onClosed = onClosed;
    }

    void open() {
        if (state.compareAndSet(ChannelState.CONNECTING, ChannelState.OPEN)) {
            log.debug("Channel {} open for user {}", id, userId);
        }
    }

    Offer offer(NotificationView notification) {
        if (state.get() != ChannelState.OPEN) {
            return Offer.CLOSED;
        }
        if (!buffer.offer(Push.of(notification))) {
            fail(new DeliveryFailureException("Outbound buffer full for channel " + id
                    + " (" + buffer.size() + " pending)"));
            return Offer.OVERFLOW;
        }
        scheduleDrain();
        return Offer.ACCEPTED;
    }

    void heartbeat() {
        // a backlog already keeps the connection busy
        if (state.get() == ChannelState.OPEN && buffer.isEmpty() && buffer.offer(Push.HEARTBEAT)) {
            scheduleDrain();
        }
    }

    void close() {
        if (transition(ChannelState.CLOSED_NORMAL)) {
            buffer.clear();
            sink.complete();
            onClosed.accept(this);
            log.debug("Channel {} closed for user {}", id, userId);
        }
    }

    void fail(Throwable cause) {
        if (transition(ChannelState.CLOSED_ERROR)) {
            failure = cause;
            buffer.clear();
            sink.completeWithError(cause);
            onClosed.accept(this);
            log.warn("Channel {} of user {} closed with error: {}", id, userId, cause.getMessage());
        }
    }

    private boolean transition(ChannelState target) {
        ChannelState current = state.get();
        while (!current.isClosed()) {
            if (state.compareAndSet(current, target)) {
                return true;
            }
            current = state.get();
        }
        return false;
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            sender.execute(this::drain);
        }
    }

    private void drain() {
        try {
            Push push;
            while (state.get() == ChannelState.OPEN && (push = buffer.poll()) != null) {
                deliver(push);
            }
        } catch (DeliveryFailureException e) {
            fail(e);
        } finally {
            draining.set(false);
        }
        if (state.get() == ChannelState.OPEN && !buffer.isEmpty()) {
            scheduleDrain();
        }
    }

    private void deliver(Push push) {
        try {
            if (push.isHeartbeat()) {
                sink.sendHeartbeat();
            } else {
                sink.send(push.notification());
                lastDeliveredNotificationId = push.notification().id();
            }
        } catch (IOException | RuntimeException e) {
            throw new DeliveryFailureException("Send failed on channel " + id, e);
        }
    }

    public String getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public ChannelState getState() {
        return state.get();
    }

    public long getLastDeliveredNotificationId() {
        return lastDeliveredNotificationId;
    }

    public Throwable getFailure() {
        return failure;
    }

    int pending() {
        return buffer.size();
    }

    enum Offer {
        ACCEPTED,
        CLOSED,
        OVERFLOW
    }

    private record Push(NotificationView notification) {

        static final Push HEARTBEAT = new Push(null);

        static Push of(NotificationView notification) {
            return new Push(notification);
        }

        boolean isHeartbeat() {
            return notification == null;
        }
    }
}
