package com.example.changefeed.service.history;

import com.example.changefeed.model.domain.ChangeHistoryRecord;
import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.dto.HistoryEntryView;
import com.example.changefeed.model.dto.HistoryPage;
import com.example.changefeed.repository.ChangeHistoryRecordRepository;
import com.example.changefeed.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the audit trail.
 */
@Service
@RequiredArgsConstructor
public class ChangeHistoryService {

    private final ChangeHistoryRecordRepository historyRepository;

    @Transactional(readOnly = true)
    public HistoryPage getHistory(EntityType entityType, Long entityId, int limit, int offset) {
        Page<ChangeHistoryRecord> page = historyRepository.findByEntityTypeAndEntityIdOrderByIdDesc(
                entityType, entityId, OffsetPageRequest.of(offset, limit));
        return new HistoryPage(
                page.map(HistoryEntryView::from).getContent(),
                page.getTotalElements());
    }
}
