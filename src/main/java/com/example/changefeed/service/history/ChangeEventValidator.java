package com.example.changefeed.service.history;

import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.FieldChange;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Structural checks shared by the enqueue path (which rejects) and the
 * history writer (which dead-letters).
 */
@Component
public class ChangeEventValidator {

    /**
     * @return the reason the event is malformed, or empty if it is acceptable
     */
    public Optional<String> validate(ChangeEvent event) {
        if (event == null) {
            return Optional.of("event is missing");
        }
        if (event.entityType() == null) {
            return Optional.of("unknown or missing entity_type");
        }
        if (event.entityId() == null) {
            return Optional.of("entity_id is required");
        }
        if (event.actorUserId() == null) {
            return Optional.of("actor_user_id is required");
        }
        if (event.dedupKey() == null || event.dedupKey().isBlank()) {
            return Optional.of("dedup_key is required");
        }
        if (event.fieldChanges().isEmpty()) {
            return Optional.of("field_changes must not be empty");
        }
        for (FieldChange change : event.fieldChanges()) {
            if (change == null || change.field() == null || change.field().isBlank()) {
                return Optional.of("every field change needs a field name");
            }
        }
        return Optional.empty();
    }
}
