package com.example.changefeed.client;

import com.example.changefeed.model.dto.NotificationView;

import java.util.List;

public interface NotificationBackfill {

    /**
     * One page of notifications with an id greater than {@code lastSeenId},
     * ascending. The server caps the page size, so callers keep asking
     * from the last id returned until a page comes back empty.
     */
    List<NotificationView> fetchSince(long lastSeenId);
}
