package com.example.changefeed.service.fanout;

import com.example.changefeed.model.dto.NotificationView;
import com.example.changefeed.service.PipelineMetrics;
import com.example.changefeed.service.notification.NotificationCreatedEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of open live channels and fan-out of committed notifications to
 * them. A user may hold several channels (tabs, devices); each receives
 * every notification of that user.
 *
 * Delivery is best effort. A notification that cannot be pushed stays in
 * the database and reaches the client through backfill.
 */
@Slf4j
@Service
public class NotificationFanoutManager {

    private final Map<Long, Set<LiveChannel>> channelsByUser = new HashMap<>();
    private final ReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final int channelBuffer;
    private final Executor sender;
    private final ExecutorService ownedSender;
    private final PipelineMetrics metrics;

    @Autowired
    public NotificationFanoutManager(@Value("${app.notifications.channel-buffer:100}") int channelBuffer,
                                     @Value("${app.notifications.sender-threads:4}") int senderThreads,
                                     PipelineMetrics metrics) {
        this.channelBuffer = channelBuffer;
        this.ownedSender = Executors.newFixedThreadPool(senderThreads, senderThreadFactory());
        this.sender = ownedSender;
        this.metrics = metrics;
    }

    NotificationFanoutManager(int channelBuffer, Executor sender, PipelineMetrics metrics) {
        this.channelBuffer = channelBuffer;
        this.ownedSender = null;
        this.sender = sender;
        this.metrics = metrics;
    }

    /**
     * Registers a new channel for the user and moves it to {@link ChannelState#OPEN}.
     */
    public LiveChannel open(Long userId, ChannelSink sink) {
        LiveChannel channel = new LiveChannel(userId, sink, channelBuffer, sender, this::unregister);
        registryLock.writeLock().lock();
        try {
            channelsByUser.computeIfAbsent(userId, id -> new LinkedHashSet<>()).add(channel);
        } finally {
            registryLock.writeLock().unlock();
        }
        sink.onTermination(channel::close, channel::fail);
        channel.open();
        log.info("📡 Live channel {} opened for user {}", channel.getId(), userId);
        return channel;
    }

    public void close(LiveChannel channel) {
        channel.close();
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotificationCreated(NotificationCreatedEvent event) {
        publish(event.notification());
    }

    /**
     * Pushes the notification to every open channel of its recipient without
     * waiting for the sends.
     *
     * @return number of channels that accepted the push
     */
    public int publish(NotificationView notification) {
        List<LiveChannel> targets = channelsOf(notification.recipientUserId());
        int accepted = 0;
        for (LiveChannel channel : targets) {
            LiveChannel.Offer offer = channel.offer(notification);
            if (offer == LiveChannel.Offer.ACCEPTED) {
                accepted++;
            } else if (offer == LiveChannel.Offer.OVERFLOW) {
                metrics.recordSlowConsumer();
            }
        }
        log.debug("Notification {} offered to {}/{} channel(s) of user {}",
                notification.id(), accepted, targets.size(), notification.recipientUserId());
        return accepted;
    }

    @Scheduled(fixedDelayString = "${app.notifications.heartbeat-interval:PT30S}",
            initialDelayString = "${app.notifications.heartbeat-interval:PT30S}")
    public void sendHeartbeats() {
        for (LiveChannel channel : allChannels()) {
            channel.heartbeat();
        }
    }

    public int openChannelCount(Long userId) {
        return channelsOf(userId).size();
    }

    public int openChannelCount() {
        return allChannels().size();
    }

    @PreDestroy
    public void shutdown() {
        List<LiveChannel> channels = allChannels();
        channels.forEach(LiveChannel::close);
        if (ownedSender != null) {
            ownedSender.shutdown();
            try {
                if (!ownedSender.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedSender.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedSender.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Closed {} live channel(s) on shutdown", channels.size());
    }

    private void unregister(LiveChannel channel) {
        registryLock.writeLock().lock();
        try {
            Set<LiveChannel> channels = channelsByUser.get(channel.getUserId());
            if (channels != null) {
                channels.remove(channel);
                if (channels.isEmpty()) {
                    channelsByUser.remove(channel.getUserId());
                }
            }
        } finally {
            registryLock.writeLock().unlock();
        }
        if (channel.getState() == ChannelState.CLOSED_ERROR) {
            metrics.recordDeliveryFailure();
        }
        log.info("Live channel {} of user {} unregistered ({})",
                channel.getId(), channel.getUserId(), channel.getState());
    }

    private List<LiveChannel> channelsOf(Long userId) {
        registryLock.readLock().lock();
        try {
            Set<LiveChannel> channels = channelsByUser.get(userId);
            return channels == null ? List.of() : new ArrayList<>(channels);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private List<LiveChannel> allChannels() {
        registryLock.readLock().lock();
        try {
            List<LiveChannel> all = new ArrayList<>();
            channelsByUser.values().forEach(all::addAll);
            return all;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private static ThreadFactory senderThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "live-sender-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
