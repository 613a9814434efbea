package com.example.changefeed.service.notification;

import com.example.changefeed.exception.ForbiddenException;
import com.example.changefeed.exception.NotFoundException;
import com.example.changefeed.model.domain.Notification;
import com.example.changefeed.model.domain.NotificationType;
import com.example.changefeed.model.dto.NotificationPage;
import com.example.changefeed.model.dto.NotificationView;
import com.example.changefeed.model.dto.ReadResult;
import com.example.changefeed.repository.NotificationRepository;
import com.example.changefeed.repository.OffsetPageRequest;
import com.example.changefeed.service.PipelineMetrics;
import com.example.changefeed.service.mention.Recipient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Persistence and read-state handling of notifications.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    static final int BACKFILL_LIMIT = 200;

    private final NotificationRepository notificationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final PipelineMetrics metrics;

    /**
     * Inserts one notification per recipient and announces each for live
     * delivery once the surrounding transaction commits.
     */
    @Transactional
    public List<Notification> createNotifications(Collection<Recipient> recipients,
                                                  Long actorUserId,
                                                  String actorUsername,
                                                  Long commentId) {
        List<Notification> created = new ArrayList<>();
        for (Recipient recipient : recipients) {
            Notification notification = notificationRepository.save(new Notification(
                    recipient.type(),
                    messageFor(recipient.type(), actorUsername),
                    commentId,
                    actorUserId,
                    recipient.recipientUserId()));
            created.add(notification);
            eventPublisher.publishEvent(new NotificationCreatedEvent(NotificationView.from(notification)));
        }
        if (!created.isEmpty()) {
            metrics.recordNotificationsCreated(created.size());
            log.info("Created {} notification(s) for comment {}", created.size(), commentId);
        }
        return created;
    }

    @Transactional(readOnly = true)
    public NotificationPage listNotifications(Long userId, int limit, int offset) {
        Page<Notification> page = notificationRepository.findByRecipientUserIdOrderByIdDesc(
                userId, OffsetPageRequest.of(offset, limit));
        long unread = notificationRepository.countByRecipientUserIdAndReadFalse(userId);
        return new NotificationPage(
                page.map(NotificationView::from).getContent(),
                page.getTotalElements(),
                unread);
    }

    /**
     * Notifications created for the user after {@code lastSeenId}, oldest first.
     */
    @Transactional(readOnly = true)
    public List<NotificationView> fetchSince(Long userId, long lastSeenId) {
        return notificationRepository.findByRecipientUserIdAndIdGreaterThanOrderByIdAsc(
                        userId, lastSeenId, OffsetPageRequest.of(0, BACKFILL_LIMIT))
                .stream()
                .map(NotificationView::from)
                .toList();
    }

    /**
     * @throws NotFoundException  if the notification does not exist
     * @throws ForbiddenException if it belongs to another user
     */
    @Transactional
    public ReadResult markAsRead(Long notificationId, Long currentUserId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new NotFoundException("notification", notificationId));
        if (!notification.getRecipientUserId().equals(currentUserId)) {
            throw new ForbiddenException("mark as read", "notification");
        }
        boolean changed = notification.markRead();
        return new ReadResult(true, changed ? 1 : 0);
    }

    @Transactional
    public ReadResult markAllAsRead(Long currentUserId) {
        int count = notificationRepository.markAllReadForRecipient(currentUserId);
        log.debug("Marked {} notification(s) read for user {}", count, currentUserId);
        return new ReadResult(true, count);
    }

    static String messageFor(NotificationType type, String actorUsername) {
        String actor = actorUsername != null ? "@" + actorUsername : "Someone";
        return switch (type) {
            case MENTION -> actor + " mentioned you in a comment";
            case REPLY -> actor + " replied to your comment";
        };
    }
}
