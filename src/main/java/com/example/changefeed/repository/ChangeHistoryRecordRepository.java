package com.example.changefeed.repository;

import com.example.changefeed.model.domain.ChangeHistoryRecord;
import com.example.changefeed.model.domain.EntityType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChangeHistoryRecordRepository extends JpaRepository<ChangeHistoryRecord, Long> {

    /**
     * Idempotence check used by the history writer before appending.
     */
    boolean existsByDedupKey(String dedupKey);

    /**
     * History of one entity, newest first. Identity order is creation order.
     */
    Page<ChangeHistoryRecord> findByEntityTypeAndEntityIdOrderByIdDesc(EntityType entityType,
                                                                       Long entityId,
                                                                       Pageable pageable);

    List<ChangeHistoryRecord> findByEntityTypeAndEntityIdOrderByIdAsc(EntityType entityType, Long entityId);

    long countByDedupKey(String dedupKey);
}
