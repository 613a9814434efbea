package com.example.changefeed.service.notification;

import com.example.changefeed.model.dto.NotificationView;

/**
 * Published inside the transaction that inserts a notification; live
 * delivery listens for it after commit.
 */
public record NotificationCreatedEvent(NotificationView notification) {
}
