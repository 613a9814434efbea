package com.example.changefeed.client;

final class NotificationHttpHeaders {

    static final String USER_ID = "X-User-Id";

    private NotificationHttpHeaders() {
    }
}
