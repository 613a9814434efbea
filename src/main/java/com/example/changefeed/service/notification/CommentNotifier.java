package com.example.changefeed.service.notification;

import com.example.changefeed.exception.RetryableJobException;
import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.domain.Notification;
import com.example.changefeed.model.domain.ProcessedEvent;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.CommentContext;
import com.example.changefeed.model.dto.FieldChange;
import com.example.changefeed.repository.ProcessedEventRepository;
import com.example.changefeed.service.mention.MentionResolver;
import com.example.changefeed.service.mention.Recipient;
import com.example.changefeed.service.user.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns comment change events into mention and reply notifications.
 *
 * A new comment notifies its whole audience. An edit only notifies users the
 * new text adds, so editing never repeats a notification. Each event is
 * applied at most once, tracked through {@link ProcessedEvent}.
 */
@Slf4j
@Service
public class CommentNotifier {

    static final String CONTENT_FIELD = "content";
    static final String PROCESSED_PREFIX = "notification:";

    private final MentionResolver mentionResolver;
    private final NotificationService notificationService;
    private final ProcessedEventRepository processedEventRepository;
    private final UserDirectory userDirectory;
    private final TransactionTemplate transactionTemplate;

    public CommentNotifier(MentionResolver mentionResolver,
                           NotificationService notificationService,
                           ProcessedEventRepository processedEventRepository,
                           UserDirectory userDirectory,
                           PlatformTransactionManager transactionManager) {
        this.mentionResolver = mentionResolver;
        this.notificationService = notificationService;
        this.processedEventRepository = processedEventRepository;
        this.userDirectory = userDirectory;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @return the notifications created for this event, empty if it is not a
     *         comment content change, has no audience or was already applied
     * @throws RetryableJobException on storage failures
     */
    public List<Notification> notifyFor(ChangeEvent event) {
        if (event.entityType() != EntityType.COMMENT || event.commentContext() == null) {
            return List.of();
        }
        Optional<FieldChange> contentChange = event.fieldChange(CONTENT_FIELD);
        if (contentChange.isEmpty() || contentChange.get().isNoOp()) {
            return List.of();
        }

        Set<Recipient> recipients = audienceOf(contentChange.get(), event.commentContext());
        if (recipients.isEmpty()) {
            log.debug("No audience for comment {} dedupKey={}", event.entityId(), event.dedupKey());
            return List.of();
        }

        String processedKey = PROCESSED_PREFIX + event.dedupKey();
        try {
            List<Notification> created = transactionTemplate.execute(status -> {
                if (processedEventRepository.existsByEventKey(processedKey)) {
                    log.info("Notifications for dedupKey={} already created, skipping", event.dedupKey());
                    return List.<Notification>of();
                }
                String actorUsername = userDirectory.findUsername(event.actorUserId()).orElse(null);
                List<Notification> notifications = notificationService.createNotifications(
                        recipients, event.actorUserId(), actorUsername, event.entityId());
                processedEventRepository.saveAndFlush(new ProcessedEvent(processedKey));
                return notifications;
            });
            return created == null ? List.of() : created;
        } catch (DataIntegrityViolationException e) {
            log.info("Notifications for dedupKey={} committed concurrently, skipping", event.dedupKey());
            return List.of();
        } catch (DataAccessException | TransactionException e) {
            throw new RetryableJobException("Storage unavailable while creating notifications for comment "
                    + event.entityId(), e);
        }
    }

    private Set<Recipient> audienceOf(FieldChange contentChange, CommentContext context) {
        Set<Recipient> recipients = new LinkedHashSet<>(
                mentionResolver.resolve(asText(contentChange.newValue()), context));
        if (contentChange.oldValue() != null) {
            recipients.removeAll(mentionResolver.resolve(asText(contentChange.oldValue()), context));
        }
        return recipients;
    }

    private static String asText(Object value) {
        return value == null ? "" : value.toString();
    }
}
