package com.example.changefeed.model.dto;

import java.util.List;

/**
 * A page of history entries, newest first, with the total number of entries
 * recorded for the entity.
 */
public record HistoryPage(
        List<HistoryEntryView> history,
        long total
) {
}
