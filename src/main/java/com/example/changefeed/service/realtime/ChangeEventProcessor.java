package com.example.changefeed.service.realtime;

import com.example.changefeed.model.domain.Notification;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.queue.ChangeJobHandler;
import com.example.changefeed.service.PipelineMetrics;
import com.example.changefeed.service.history.ChangeHistoryWriter;
import com.example.changefeed.service.history.WriteOutcome;
import com.example.changefeed.service.notification.CommentNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Orchestrates one change job: audit record first, then notifications.
 *
 * Both steps are idempotent, so a redelivered job that already wrote its
 * history still gets its notifications created.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeEventProcessor implements ChangeJobHandler {

    private final ChangeHistoryWriter historyWriter;
    private final CommentNotifier commentNotifier;
    private final PipelineMetrics metrics;

    @Override
    public void handle(ChangeEvent event) {
        log.info("🔄 Processing change event: entity='{}', fields={}, dedupKey='{}'",
                event.entityKey(), event.fieldChanges().size(), event.dedupKey());

        WriteOutcome outcome = historyWriter.process(event);
        switch (outcome) {
            case COMMITTED -> metrics.recordCommitted();
            case DUPLICATE -> metrics.recordDuplicate();
            case NO_CHANGES -> log.debug("No effective field changes in {}", event.dedupKey());
        }

        List<Notification> notifications = commentNotifier.notifyFor(event);

        log.info("✅ Processed change event {} ({}), {} notification(s) created",
                event.dedupKey(), outcome, notifications.size());
    }
}
