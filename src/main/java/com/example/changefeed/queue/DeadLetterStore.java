package com.example.changefeed.queue;

import com.example.changefeed.model.domain.FailedEvent;
import com.example.changefeed.repository.FailedEventRepository;
import com.example.changefeed.service.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Final resting place of jobs that were poisoned or ran out of attempts.
 * Entries are never retried automatically.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeadLetterStore {

    static final int MAX_REASON_LENGTH = 2048;

    private final FailedEventRepository failedEventRepository;
    private final PipelineMetrics metrics;

    @Transactional
    public FailedEvent deadLetter(String eventKey, String payload, String reason, int attempts, boolean poisoned) {
        FailedEvent failed = failedEventRepository.save(
                new FailedEvent(eventKey, payload, truncate(reason), attempts));
        metrics.recordDeadLetter();
        if (poisoned) {
            metrics.recordPoisoned();
            log.error("☠️ [DEAD-LETTER] Poisoned job {} dead-lettered: {}", eventKey, reason);
        } else {
            log.error("☠️ [DEAD-LETTER] Job {} dead-lettered after {} attempt(s): {}", eventKey, attempts, reason);
        }
        return failed;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
