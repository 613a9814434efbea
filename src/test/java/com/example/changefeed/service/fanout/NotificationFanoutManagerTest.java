package com.example.changefeed.service.fanout;

import com.example.changefeed.exception.DeliveryFailureException;
import com.example.changefeed.model.domain.NotificationType;
import com.example.changefeed.model.dto.NotificationView;
import com.example.changefeed.service.PipelineMetrics;
import com.example.changefeed.service.notification.NotificationCreatedEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationFanoutManager Tests")
class NotificationFanoutManagerTest {

    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    private SimpleMeterRegistry meterRegistry;
    private PipelineMetrics metrics;
    private ManualExecutor sender;
    private NotificationFanoutManager manager;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(meterRegistry);
        sender = new ManualExecutor();
        manager = new NotificationFanoutManager(3, sender, metrics);
    }

    @Nested
    @DisplayName("Broadcasting")
    class BroadcastTests {

        @Test
        @DisplayName("Should push to every open channel of the recipient only")
        void shouldPushToRecipientChannels() {
            // Given
            RecordingSink aliceTab = new RecordingSink();
            RecordingSink alicePhone = new RecordingSink();
            RecordingSink bobTab = new RecordingSink();
            manager.open(ALICE, aliceTab);
            manager.open(ALICE, alicePhone);
            manager.open(BOB, bobTab);

            // When
            int accepted = manager.publish(notification(11L, ALICE));
            sender.runAll();

            // Then
            assertThat(accepted).isEqualTo(2);
            assertThat(aliceTab.sentIds).containsExactly(11L);
            assertThat(alicePhone.sentIds).containsExactly(11L);
            assertThat(bobTab.sentIds).isEmpty();
        }

        @Test
        @DisplayName("Should deliver in the order notifications were published")
        void shouldPreserveOrder() {
            // Given
            RecordingSink sink = new RecordingSink();
            LiveChannel channel = manager.open(ALICE, sink);

            // When
            manager.publish(notification(11L, ALICE));
            manager.publish(notification(12L, ALICE));
            manager.publish(notification(13L, ALICE));
            sender.runAll();

            // Then
            assertThat(sink.sentIds).containsExactly(11L, 12L, 13L);
            assertThat(channel.getLastDeliveredNotificationId()).isEqualTo(13L);
            assertThat(sender.submitted).isEqualTo(1);
        }

        @Test
        @DisplayName("Should publish committed notifications from the creation event")
        void shouldPublishOnCreationEvent() {
            RecordingSink sink = new RecordingSink();
            manager.open(ALICE, sink);

            manager.onNotificationCreated(new NotificationCreatedEvent(notification(21L, ALICE)));
            sender.runAll();

            assertThat(sink.sentIds).containsExactly(21L);
        }

        @Test
        @DisplayName("Should accept notifications for users without channels")
        void shouldIgnoreOfflineUsers() {
            assertThat(manager.publish(notification(11L, BOB))).isZero();
        }
    }

    @Nested
    @DisplayName("Backpressure and failures")
    class FailureTests {

        @Test
        @DisplayName("Should close a channel whose buffer overflows")
        void shouldCloseSlowConsumer() {
            // Given
            RecordingSink sink = new RecordingSink();
            LiveChannel channel = manager.open(ALICE, sink);

            // When
            for (long id = 1; id <= 4; id++) {
                manager.publish(notification(id, ALICE));
            }

            // Then
            assertThat(channel.getState()).isEqualTo(ChannelState.CLOSED_ERROR);
            assertThat(channel.getFailure()).isInstanceOf(DeliveryFailureException.class);
            assertThat(sink.error).isSameAs(channel.getFailure());
            assertThat(manager.openChannelCount(ALICE)).isZero();
            assertThat(meterRegistry.counter("notifications.delivery.slow_consumers").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("notifications.delivery.failures").count()).isEqualTo(1.0);

            sender.runAll();
            assertThat(sink.sentIds).isEmpty();
        }

        @Test
        @DisplayName("Should close a channel when a send fails and keep serving others")
        void shouldCloseChannelOnSendFailure() {
            // Given
            RecordingSink broken = new RecordingSink();
            broken.failSends = true;
            RecordingSink healthy = new RecordingSink();
            LiveChannel brokenChannel = manager.open(ALICE, broken);
            manager.open(ALICE, healthy);

            // When
            manager.publish(notification(11L, ALICE));
            sender.runAll();
            manager.publish(notification(12L, ALICE));
            sender.runAll();

            // Then
            assertThat(brokenChannel.getState()).isEqualTo(ChannelState.CLOSED_ERROR);
            assertThat(healthy.sentIds).containsExactly(11L, 12L);
            assertThat(manager.openChannelCount(ALICE)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should unregister a channel when the client goes away")
        void shouldUnregisterOnClientDisconnect() {
            RecordingSink sink = new RecordingSink();
            LiveChannel channel = manager.open(ALICE, sink);

            sink.terminate();

            assertThat(channel.getState()).isEqualTo(ChannelState.CLOSED_NORMAL);
            assertThat(manager.openChannelCount()).isZero();
            assertThat(manager.publish(notification(11L, ALICE))).isZero();
            assertThat(meterRegistry.counter("notifications.delivery.failures").count()).isZero();
        }

        @Test
        @DisplayName("Should fail a channel whose transport reports an error")
        void shouldFailChannelOnTransportError() {
            // Given
            RecordingSink sink = new RecordingSink();
            LiveChannel channel = manager.open(ALICE, sink);
            IOException cause = new IOException("Connection reset by peer");

            // When
            sink.breakTransport(cause);

            // Then
            assertThat(channel.getState()).isEqualTo(ChannelState.CLOSED_ERROR);
            assertThat(channel.getFailure()).isSameAs(cause);
            assertThat(manager.openChannelCount()).isZero();
            assertThat(meterRegistry.counter("notifications.delivery.failures").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Heartbeats and shutdown")
    class LifecycleTests {

        @Test
        @DisplayName("Should send heartbeats to idle channels")
        void shouldSendHeartbeats() {
            RecordingSink sink = new RecordingSink();
            manager.open(ALICE, sink);

            manager.sendHeartbeats();
            sender.runAll();

            assertThat(sink.heartbeats).isEqualTo(1);
            assertThat(sink.sentIds).isEmpty();
        }

        @Test
        @DisplayName("Should skip the heartbeat while notifications are pending")
        void shouldSkipHeartbeatWithBacklog() {
            RecordingSink sink = new RecordingSink();
            manager.open(ALICE, sink);

            manager.publish(notification(11L, ALICE));
            manager.sendHeartbeats();
            sender.runAll();

            assertThat(sink.heartbeats).isZero();
            assertThat(sink.sentIds).containsExactly(11L);
        }

        @Test
        @DisplayName("Should close every channel on shutdown")
        void shouldCloseOnShutdown() {
            RecordingSink first = new RecordingSink();
            RecordingSink second = new RecordingSink();
            manager.open(ALICE, first);
            manager.open(BOB, second);

            manager.shutdown();

            assertThat(first.completed).isTrue();
            assertThat(second.completed).isTrue();
            assertThat(manager.openChannelCount()).isZero();
        }
    }

    private static NotificationView notification(long id, long recipient) {
        return new NotificationView(id, NotificationType.MENTION, "@carol mentioned you in a comment", false,
                55L, 3L, recipient, Instant.parse("2024-05-01T10:00:00Z"));
    }

    static final class ManualExecutor implements Executor {
        private final Deque<Runnable> tasks = new ArrayDeque<>();
        int submitted;

        @Override
        public void execute(Runnable command) {
            submitted++;
            tasks.add(command);
        }

        void runAll() {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
            }
        }
    }

    static final class RecordingSink implements ChannelSink {
        final List<Long> sentIds = new ArrayList<>();
        int heartbeats;
        boolean completed;
        Throwable error;
        boolean failSends;
        private Runnable onClosed = () -> { };
        private Consumer<Throwable> onError = error -> { };

        @Override
        public void send(NotificationView notification) throws IOException {
            if (failSends) {
                throw new IOException("Broken pipe");
            }
            sentIds.add(notification.id());
        }

        @Override
        public void sendHeartbeat() {
            heartbeats++;
        }

        @Override
        public void complete() {
            completed = true;
        }

        @Override
        public void completeWithError(Throwable cause) {
            error = cause;
        }

        @Override
        public void onTermination(Runnable onClosed, Consumer<Throwable> onError) {
            this.onClosed = onClosed;
            this.onError = onError;
        }

        void terminate() {
            onClosed.run();
        }

        void breakTransport(Throwable cause) {
            onError.accept(cause);
        }
    }
}
