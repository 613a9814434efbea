package com.example.changefeed.lock;

import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.dto.ChangeEvent;

import java.util.Objects;

/**
 * Mutual exclusion key of the history writer: one entity row.
 */
public record EntityKey(EntityType entityType, Long entityId) {

    public EntityKey {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
    }

    public static EntityKey of(ChangeEvent event) {
        return new EntityKey(event.entityType(), event.entityId());
    }

    @Override
    public String toString() {
        return entityType.getValue() + "-" + entityId;
    }
}
