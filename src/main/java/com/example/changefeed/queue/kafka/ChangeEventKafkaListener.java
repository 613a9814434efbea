package com.example.changefeed.queue.kafka;

import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.queue.ChangeJobHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes change jobs and acknowledges them only after the handler
 * finished. Exceptions are left to the container's error handler, which
 * retries retryable failures and dead-letters the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.queue.type", havingValue = "kafka", matchIfMissing = true)
public class ChangeEventKafkaListener {

    private final ChangeJobHandler handler;
    private final ObjectMapper objectMapper;

    @KafkaListener(id = "changeEventsListener",
            topics = "${app.kafka.topics.change-events}",
            groupId = "${app.kafka.group-id}",
            containerFactory = KafkaQueueConfig.CONTAINER_FACTORY)
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.info("[KAFKA-QUEUE] Received job key={} partition={} offset={}",
                record.key(), record.partition(), record.offset());
        ChangeEvent event = parse(record);
        handler.handle(event);
        ack.acknowledge();
    }

    ChangeEvent parse(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            throw new PoisonedJobException("Empty payload for key " + record.key());
        }
        try {
            return objectMapper.readValue(record.value(), ChangeEvent.class);
        } catch (JsonProcessingException e) {
            throw new PoisonedJobException("Malformed change event for key " + record.key()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
