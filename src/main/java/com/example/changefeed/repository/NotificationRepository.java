package com.example.changefeed.repository;

import com.example.changefeed.model.domain.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    Page<Notification> findByRecipientUserIdOrderByIdDesc(Long recipientUserId, Pageable pageable);

    long countByRecipientUserIdAndReadFalse(Long recipientUserId);

    /**
     * Backfill query: everything created for the user after the last id the
     * client has seen, oldest first.
     */
    List<Notification> findByRecipientUserIdAndIdGreaterThanOrderByIdAsc(Long recipientUserId,
                                                                        Long lastSeenId,
                                                                        Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Notification n set n.read = true where n.recipientUserId = :userId and n.read = false")
    int markAllReadForRecipient(@Param("userId") Long userId);
}
