package com.example.changefeed.service.mention;

import com.example.changefeed.model.domain.NotificationType;

/**
 * One member of a notification audience. Value equality makes a set of
 * recipients collapse repeated mentions of the same user.
 */
public record Recipient(Long recipientUserId, NotificationType type) {
}
