package com.example.changefeed.model.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit entry for a single field change of a tracked entity.
 *
 * Rows are written exclusively by the history writer and are never updated
 * or deleted. For a fixed entity the identity column gives the total order
 * of its records.
 */
@Getter
@Entity
@Immutable
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "change_history",
        indexes = @Index(name = "ix_change_history_entity", columnList = "entity_type, entity_id"),
        uniqueConstraints = @UniqueConstraint(name = "uk_change_history_dedup",
                columnNames = {"dedup_key", "field_position"}))
public class ChangeHistoryRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 50)
    private EntityType entityType;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_value")
    private Map<String, Object> oldValue; // null when the field had no previous value

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_value", nullable = false)
    private Map<String, Object> newValue;

    @Column(name = "changed_by_user_id", nullable = false)
    private Long changedByUserId;

    @Column(name = "changed_by_username")
    private String changedByUsername;

    @Column(name = "dedup_key", nullable = false)
    private String dedupKey;

    @Column(name = "field_position", nullable = false)
    private int fieldPosition;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    public ChangeHistoryRecord(EntityType entityType,
                               Long entityId,
                               Map<String, Object> oldValue,
                               Map<String, Object> newValue,
                               Long changedByUserId,
                               String changedByUsername,
                               String dedupKey,
                               int fieldPosition) {
        this.entityType = entityType;
        this.entityId = entityId;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.changedByUserId = changedByUserId;
        this.changedByUsername = changedByUsername;
        this.dedupKey = dedupKey;
        this.fieldPosition = fieldPosition;
    }
}
