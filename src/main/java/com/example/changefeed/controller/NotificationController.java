package com.example.changefeed.controller;

import com.example.changefeed.model.dto.NotificationPage;
import com.example.changefeed.model.dto.NotificationView;
import com.example.changefeed.model.dto.ReadResult;
import com.example.changefeed.service.fanout.NotificationFanoutManager;
import com.example.changefeed.service.fanout.SseChannelSink;
import com.example.changefeed.service.notification.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * Notification API of the calling user, identified by the {@code X-User-Id}
 * header.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    public static final String USER_HEADER = "X-User-Id";
    static final int MAX_LIMIT = 50;

    private final NotificationService notificationService;
    private final NotificationFanoutManager fanoutManager;

    @GetMapping
    public NotificationPage list(@RequestHeader(USER_HEADER) Long userId,
                                 @RequestParam(defaultValue = "5") int limit,
                                 @RequestParam(defaultValue = "0") int offset) {
        Paging.check(limit, offset, MAX_LIMIT);
        return notificationService.listNotifications(userId, limit, offset);
    }

    @PatchMapping("/{id}/read")
    public ReadResult markAsRead(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return notificationService.markAsRead(id, userId);
    }

    @PatchMapping("/read-all")
    public ReadResult markAllAsRead(@RequestHeader(USER_HEADER) Long userId) {
        return notificationService.markAllAsRead(userId);
    }

    /**
     * Backfill for reconnecting clients: everything after {@code last_seen_id}, oldest first.
     */
    @GetMapping("/since")
    public List<NotificationView> since(@RequestHeader(USER_HEADER) Long userId,
                                        @RequestParam(name = "last_seen_id", defaultValue = "0") long lastSeenId) {
        if (lastSeenId < 0) {
            throw new IllegalArgumentException("last_seen_id must not be negative");
        }
        return notificationService.fetchSince(userId, lastSeenId);
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@RequestHeader(USER_HEADER) Long userId) {
        SseChannelSink sink = SseChannelSink.withoutTimeout();
        fanoutManager.open(userId, sink);
        log.info("📡 Live stream requested by user {}", userId);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(sink.getEmitter());
    }
}
