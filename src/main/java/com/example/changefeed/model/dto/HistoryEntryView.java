package com.example.changefeed.model.dto;

import com.example.changefeed.model.domain.ChangeHistoryRecord;
import com.example.changefeed.model.domain.EntityType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HistoryEntryView(
        Long id,
        EntityType entityType,
        Long entityId,
        Map<String, Object> oldValue,
        Map<String, Object> newValue,
        Long changedByUserId,
        String changedByUsername,
        Instant createdAt
) {

    public static HistoryEntryView from(ChangeHistoryRecord record) {
        return new HistoryEntryView(
                record.getId(),
                record.getEntityType(),
                record.getEntityId(),
                record.getOldValue(),
                record.getNewValue(),
                record.getChangedByUserId(),
                record.getChangedByUsername(),
                record.getCreatedAt());
    }
}
