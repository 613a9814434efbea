package com.example.changefeed.model.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Dead-letter entry for a change event that was poisoned or exhausted its
 * retries. Kept for inspection and alerting, never retried automatically.
 */
@Entity
@Table(name = "failed_events")
public class FailedEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_key", nullable = false)
    private String eventKey;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(length = 2048)
    private String reason;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    protected FailedEvent() {
    }

    public FailedEvent(String eventKey, String payload, String reason, int attempts) {
        this.eventKey = eventKey;
        this.payload = payload;
        this.reason = reason;
        this.attempts = attempts;
    }

    public Long getId() {
        return id;
    }

    public String getEventKey() {
        return eventKey;
    }

    public String getPayload() {
        return payload;
    }

    public String getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
