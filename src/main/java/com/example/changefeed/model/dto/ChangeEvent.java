package com.example.changefeed.model.dto;

import com.example.changefeed.model.domain.EntityType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable record of one accepted mutation of tracked fields, emitted by the
 * CRUD write path and carried through the job queue.
 *
 * @param entityType     kind of entity that changed
 * @param entityId       identifier of the changed row
 * @param fieldChanges   ordered field transitions
 * @param actorUserId    user who made the change
 * @param occurredAt     time the write path accepted the mutation
 * @param dedupKey       identity of the mutation, shared by all redeliveries
 * @param commentContext audience context, present for comment events only
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeEvent(
        EntityType entityType,
        Long entityId,
        List<FieldChange> fieldChanges,
        Long actorUserId,
        Instant occurredAt,
        String dedupKey,
        CommentContext commentContext
) {

    public ChangeEvent {
        fieldChanges = fieldChanges == null ? List.of() : List.copyOf(fieldChanges);
    }

    /**
     * Queue partition and lock key, e.g. {@code invoice_line_item-42}.
     */
    @JsonIgnore
    public String entityKey() {
        return (entityType != null ? entityType.getValue() : "unknown") + "-" + entityId;
    }

    @JsonIgnore
    public Optional<FieldChange> fieldChange(String field) {
        return fieldChanges.stream()
                .filter(change -> field.equals(change.field()))
                .findFirst();
    }
}
