package com.example.changefeed;

import com.example.changefeed.model.domain.AppUser;
import com.example.changefeed.model.domain.ChangeHistoryRecord;
import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.domain.Notification;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.CommentContext;
import com.example.changefeed.model.dto.FieldChange;
import com.example.changefeed.model.dto.NotificationView;
import com.example.changefeed.queue.ChangeEventPublisher;
import com.example.changefeed.queue.memory.InMemoryChangeJobQueue;
import com.example.changefeed.repository.AppUserRepository;
import com.example.changefeed.repository.ChangeHistoryRecordRepository;
import com.example.changefeed.repository.FailedEventRepository;
import com.example.changefeed.repository.NotificationRepository;
import com.example.changefeed.repository.ProcessedEventRepository;
import com.example.changefeed.service.fanout.ChannelSink;
import com.example.changefeed.service.fanout.NotificationFanoutManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = ChangeFeedApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Change feed pipeline Integration Tests")
class ChangeFeedIntegrationTest {

    private static final Duration IDLE_TIMEOUT = Duration.ofSeconds(20);
    private static final Instant OCCURRED_AT = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ChangeEventPublisher publisher;

    @Autowired
    private InMemoryChangeJobQueue queue;

    @Autowired
    private NotificationFanoutManager fanoutManager;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private ChangeHistoryRecordRepository historyRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private FailedEventRepository failedEventRepository;

    private Long alice;
    private Long bob;
    private Long carol;

    @BeforeEach
    void setUp() throws InterruptedException {
        assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();
        notificationRepository.deleteAll();
        processedEventRepository.deleteAll();
        historyRepository.deleteAll();
        failedEventRepository.deleteAll();
        appUserRepository.deleteAll();

        alice = appUserRepository.save(new AppUser("alice")).getId();
        bob = appUserRepository.save(new AppUser("bob")).getId();
        carol = appUserRepository.save(new AppUser("carol")).getId();
    }

    @Nested
    @DisplayName("Change history")
    class HistoryTests {

        @Test
        @DisplayName("Should record an accepted change event and serve it through the history API")
        void shouldRecordAndServeHistory() throws Exception {
            // Given
            String body = """
                    {"entity_type":"invoice_line_item","entity_id":42,
                     "field_changes":[{"field":"adjustments","old_value":0,"new_value":15},
                                      {"field":"notes","old_value":"a","new_value":"a"}],
                     "actor_user_id":%d,"occurred_at":"2024-05-01T10:00:00Z","dedup_key":"ili-42-1"}
                    """.formatted(carol);

            // When
            mockMvc.perform(post("/api/v1/change-events").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.accepted").value(true));
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();

            // Then
            mockMvc.perform(get("/api/v1/history/invoice_line_item/42"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(1))
                    .andExpect(jsonPath("$.history", hasSize(1)))
                    .andExpect(jsonPath("$.history[0].old_value.adjustments").value(0))
                    .andExpect(jsonPath("$.history[0].new_value.adjustments").value(15))
                    .andExpect(jsonPath("$.history[0].changed_by_username").value("carol"));
        }

        @Test
        @DisplayName("Should keep every entity's history continuous under concurrent processing")
        void shouldKeepHistoryContinuous() throws InterruptedException {
            // Given
            int changesPerEntity = 30;

            // When
            for (int i = 0; i < changesPerEntity; i++) {
                for (long entityId = 100; entityId < 104; entityId++) {
                    publisher.enqueueChangeEvent(new ChangeEvent(EntityType.LINE_ITEM, entityId,
                            List.of(new FieldChange("status", "v" + i, "v" + (i + 1))), carol, OCCURRED_AT,
                            "li-" + entityId + "-" + i, null));
                }
            }
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();

            // Then
            for (long entityId = 100; entityId < 104; entityId++) {
                List<ChangeHistoryRecord> records =
                        historyRepository.findByEntityTypeAndEntityIdOrderByIdAsc(EntityType.LINE_ITEM, entityId);
                assertThat(records).hasSize(changesPerEntity);
                for (int i = 1; i < records.size(); i++) {
                    assertThat(records.get(i).getOldValue().get("status"))
                            .isEqualTo(records.get(i - 1).getNewValue().get("status"));
                }
            }
        }

        @Test
        @DisplayName("Should write a redelivered event only once")
        void shouldIgnoreRedelivery() throws InterruptedException {
            ChangeEvent event = new ChangeEvent(EntityType.CAMPAIGN, 9L,
                    List.of(new FieldChange("name", "Spring", "Summer"), new FieldChange("budget", 100, 200)),
                    carol, OCCURRED_AT, "campaign-9-1", null);

            publisher.enqueueChangeEvent(event);
            publisher.enqueueChangeEvent(event);
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();

            assertThat(historyRepository.countByDedupKey("campaign-9-1")).isEqualTo(2);
            assertThat(failedEventRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should reject malformed change events at the API")
        void shouldRejectMalformedEvents() throws Exception {
            mockMvc.perform(post("/api/v1/change-events").contentType(MediaType.APPLICATION_JSON)
                            .content("{\"entity_type\":\"planet\",\"entity_id\":1,\"actor_user_id\":1,"
                                    + "\"dedup_key\":\"p-1\",\"field_changes\":[{\"field\":\"x\",\"new_value\":1}]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.accepted").value(false))
                    .andExpect(jsonPath("$.reason", containsString("entity_type")));

            mockMvc.perform(post("/api/v1/change-events").contentType(MediaType.APPLICATION_JSON).content("{broken"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.reason").value("malformed change event"));

            mockMvc.perform(get("/api/v1/history/planet/1"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/v1/history/campaign/1").param("limit", "0"))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("Notifications")
    class NotificationTests {

        @Test
        @DisplayName("Should notify mentioned users once and push to their live channels")
        void shouldNotifyMentionedUsers() throws Exception {
            // Given
            LatchSink aliceLive = new LatchSink(1);
            fanoutManager.open(alice, aliceLive);
            ChangeEvent comment = commentEvent(55L, null, "Hey @alice and @bob, @alice again", "comment-55-1");

            // When
            publisher.enqueueChangeEvent(comment);
            publisher.enqueueChangeEvent(comment);
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();

            // Then
            assertThat(aliceLive.await()).isTrue();
            assertThat(aliceLive.received).extracting(NotificationView::message)
                    .containsExactly("@carol mentioned you in a comment");
            assertThat(notificationRepository.countByRecipientUserIdAndReadFalse(alice)).isEqualTo(1);
            assertThat(notificationRepository.countByRecipientUserIdAndReadFalse(bob)).isEqualTo(1);
            assertThat(notificationRepository.countByRecipientUserIdAndReadFalse(carol)).isZero();

            mockMvc.perform(get("/api/v1/notifications").header("X-User-Id", alice))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(1))
                    .andExpect(jsonPath("$.unread_count").value(1))
                    .andExpect(jsonPath("$.notifications[0].type").value("mention"))
                    .andExpect(jsonPath("$.notifications[0].is_read").value(false));
        }

        @Test
        @DisplayName("Should open a live channel for the stream endpoint")
        void shouldOpenLiveChannelOnStream() throws Exception {
            mockMvc.perform(get("/api/v1/notifications/stream").header("X-User-Id", bob))
                    .andExpect(request().asyncStarted())
                    .andExpect(header().string("X-Accel-Buffering", "no"));

            assertThat(fanoutManager.openChannelCount(bob)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should only notify users an edit adds")
        void shouldNotifyOnlyAddedUsersOnEdit() throws InterruptedException {
            publisher.enqueueChangeEvent(commentEvent(56L, null, "Thanks @alice", "comment-56-1"));
            publisher.enqueueChangeEvent(commentEvent(56L, "Thanks @alice", "Thanks @alice and @bob", "comment-56-2"));
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();

            assertThat(notificationRepository.countByRecipientUserIdAndReadFalse(alice)).isEqualTo(1);
            assertThat(notificationRepository.countByRecipientUserIdAndReadFalse(bob)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should mark notifications read and report only actual changes")
        void shouldMarkNotificationsRead() throws Exception {
            // Given
            publisher.enqueueChangeEvent(commentEvent(57L, null, "@alice @bob", "comment-57-1"));
            publisher.enqueueChangeEvent(commentEvent(58L, null, "@alice again", "comment-58-1"));
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();
            List<Notification> forBob = notificationRepository.findAll().stream()
                    .filter(n -> n.getRecipientUserId().equals(bob))
                    .toList();
            Long bobsNotification = forBob.get(0).getId();

            // Then
            mockMvc.perform(patch("/api/v1/notifications/{id}/read", bobsNotification).header("X-User-Id", alice))
                    .andExpect(status().isForbidden());
            mockMvc.perform(patch("/api/v1/notifications/{id}/read", 999_999L).header("X-User-Id", alice))
                    .andExpect(status().isNotFound());
            mockMvc.perform(patch("/api/v1/notifications/{id}/read", bobsNotification).header("X-User-Id", bob))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.read_count").value(1));
            mockMvc.perform(patch("/api/v1/notifications/read-all").header("X-User-Id", alice))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.read_count").value(2));
            mockMvc.perform(patch("/api/v1/notifications/read-all").header("X-User-Id", alice))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.read_count").value(0));
            mockMvc.perform(get("/api/v1/notifications").header("X-User-Id", alice))
                    .andExpect(jsonPath("$.unread_count").value(0));
        }

        @Test
        @DisplayName("Should backfill notifications after the last seen id")
        void shouldBackfillSinceLastSeen() throws Exception {
            publisher.enqueueChangeEvent(commentEvent(59L, null, "@alice one", "comment-59-1"));
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();
            publisher.enqueueChangeEvent(commentEvent(60L, null, "@alice two", "comment-60-1"));
            assertThat(queue.awaitIdle(IDLE_TIMEOUT)).isTrue();
            long firstId = notificationRepository.findAll().stream()
                    .mapToLong(Notification::getId)
                    .min()
                    .orElseThrow();

            mockMvc.perform(get("/api/v1/notifications/since").header("X-User-Id", alice)
                            .param("last_seen_id", String.valueOf(firstId)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(1)))
                    .andExpect(jsonPath("$[0].comment_id").value(60));
            mockMvc.perform(get("/api/v1/notifications/since").header("X-User-Id", alice)
                            .param("last_seen_id", "-1"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/v1/notifications").header("X-User-Id", alice).param("limit", "500"))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(get("/api/v1/notifications"))
                    .andExpect(status().isBadRequest());
        }
    }

    private ChangeEvent commentEvent(Long commentId, String oldContent, String newContent, String dedupKey) {
        return new ChangeEvent(EntityType.COMMENT, commentId,
                List.of(new FieldChange("content", oldContent, newContent)), carol, OCCURRED_AT, dedupKey,
                new CommentContext(10L, carol, null));
    }

    static final class LatchSink implements ChannelSink {
        final List<NotificationView> received = new CopyOnWriteArrayList<>();
        private final CountDownLatch latch;

        LatchSink(int expected) {
            this.latch = new CountDownLatch(expected);
        }

        boolean await() throws InterruptedException {
            return latch.await(5, TimeUnit.SECONDS);
        }

        @Override
        public void send(NotificationView notification) {
            received.add(notification);
            latch.countDown();
        }

        @Override
        public void sendHeartbeat() {
        }

        @Override
        public void complete() {
        }

        @Override
        public void completeWithError(Throwable cause) {
        }

        @Override
        public void onTermination(Runnable onClosed, Consumer<Throwable> onError) {
        }
    }
}
