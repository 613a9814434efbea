package com.example.changefeed.model.dto;

import com.example.changefeed.model.domain.Notification;
import com.example.changefeed.model.domain.NotificationType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Wire representation of a notification, used by the list API, the backfill
 * API and the live stream alike.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationView(
        Long id,
        NotificationType type,
        String message,
        @JsonProperty("is_read") boolean isRead,
        Long commentId,
        Long actorUserId,
        Long recipientUserId,
        Instant createdAt
) {

    public static NotificationView from(Notification notification) {
        return new NotificationView(
                notification.getId(),
                notification.getType(),
                notification.getMessage(),
                notification.isRead(),
                notification.getCommentId(),
                notification.getActorUserId(),
                notification.getRecipientUserId(),
                notification.getCreatedAt());
    }
}
