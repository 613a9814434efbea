package com.example.changefeed.queue;

import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.EnqueueResult;
import com.example.changefeed.service.history.ChangeEventValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point of the write path into the pipeline. Accepted means the event
 * will eventually be processed, not that it has been.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChangeEventPublisher {

    private final ChangeEventValidator validator;
    private final ChangeJobQueue queue;

    public EnqueueResult enqueueChangeEvent(ChangeEvent event) {
        Optional<String> problem = validator.validate(event);
        if (problem.isPresent()) {
            log.warn("Rejected change event dedupKey={}: {}",
                    event != null ? event.dedupKey() : null, problem.get());
            return EnqueueResult.rejected(problem.get());
        }
        queue.enqueue(event);
        log.debug("Enqueued change event {} dedupKey={}", event.entityKey(), event.dedupKey());
        return EnqueueResult.ok();
    }
}
