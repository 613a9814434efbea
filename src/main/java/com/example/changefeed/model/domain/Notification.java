package com.example.changefeed.model.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * In-app notification for a mention or a reply. Only the read flag ever
 * changes after creation.
 */
@Getter
@Entity
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Table(name = "notifications",
        indexes = @Index(name = "ix_notifications_recipient", columnList = "recipient_user_id"))
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private NotificationType type;

    @Column(nullable = false, length = 1024)
    private String message;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Column(name = "comment_id")
    private Long commentId;

    @Column(name = "actor_user_id")
    private Long actorUserId;

    @Column(name = "recipient_user_id", nullable = false)
    private Long recipientUserId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    public Notification(NotificationType type, String message, Long commentId,
                        Long actorUserId, Long recipientUserId) {
        this.type = type;
        this.message = message;
        this.commentId = commentId;
        this.actorUserId = actorUserId;
        this.recipientUserId = recipientUserId;
    }

    /**
     * @return true if the flag flipped, false if the notification was already read
     */
    public boolean markRead() {
        if (read) {
            return false;
        }
        read = true;
        return true;
    }
}
