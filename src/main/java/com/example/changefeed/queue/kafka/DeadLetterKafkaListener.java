package com.example.changefeed.queue.kafka;

import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.queue.DeadLetterStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Moves records from the dead-letter topic into the {@code failed_events}
 * table, where they are counted and kept for inspection.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.type", havingValue = "kafka", matchIfMissing = true)
public class DeadLetterKafkaListener {

    private final DeadLetterStore deadLetterStore;
    private final int maxAttempts;

    public DeadLetterKafkaListener(DeadLetterStore deadLetterStore,
                                   @Value("${app.queue.max-attempts:5}") int maxAttempts) {
        this.deadLetterStore = deadLetterStore;
        this.maxAttempts = maxAttempts;
    }

    @KafkaListener(id = "changeEventsDeadLetterListener",
            topics = "${app.kafka.topics.change-events-dlt}",
            groupId = "${app.kafka.group-id}-dlt")
    public void consume(ConsumerRecord<String, String> record) {
        String causeType = getHeader(record, KafkaHeaders.DLT_EXCEPTION_CAUSE_FQCN);
        String reason = getHeader(record, KafkaHeaders.DLT_EXCEPTION_MESSAGE);
        boolean poisoned = PoisonedJobException.class.getName().equals(causeType);
        deadLetterStore.deadLetter(
                record.key() != null ? record.key() : "unknown",
                record.value() != null ? record.value() : "",
                reason,
                poisoned ? 1 : maxAttempts,
                poisoned);
    }

    private String getHeader(ConsumerRecord<String, String> record, String key) {
        Header header = record.headers().lastHeader(key);
        if (header == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }
}
