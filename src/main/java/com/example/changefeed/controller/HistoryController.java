package com.example.changefeed.controller;

import com.example.changefeed.model.domain.EntityType;
import com.example.changefeed.model.dto.HistoryPage;
import com.example.changefeed.service.history.ChangeHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/history")
@RequiredArgsConstructor
public class HistoryController {

    static final int MAX_LIMIT = 100;

    private final ChangeHistoryService historyService;

    /**
     * Audit trail of one entity, newest first.
     */
    @GetMapping("/{entityType}/{entityId}")
    public HistoryPage getHistory(@PathVariable String entityType,
                                  @PathVariable Long entityId,
                                  @RequestParam(defaultValue = "50") int limit,
                                  @RequestParam(defaultValue = "0") int offset) {
        EntityType type = EntityType.fromValue(entityType);
        if (type == null) {
            throw new IllegalArgumentException("Unknown entity type: " + entityType);
        }
        Paging.check(limit, offset, MAX_LIMIT);
        return historyService.getHistory(type, entityId, limit, offset);
    }
}
