package com.example.changefeed.queue.kafka;

import com.example.changefeed.exception.QueueUnavailableException;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.queue.ChangeJobQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.common.KafkaException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes change jobs to Kafka keyed by {@link ChangeEvent#entityKey()}.
 * Enqueue returns once the broker has acknowledged the record; processing
 * happens later on the consumer side.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.queue.type", havingValue = "kafka", matchIfMissing = true)
public class KafkaChangeJobQueue implements ChangeJobQueue {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaChangeJobQueue(KafkaTemplate<String, String> kafkaTemplate,
                               ObjectMapper objectMapper,
                               @Value("${app.kafka.topics.change-events}") String topic,
                               @Value("${app.kafka.send-timeout:5s}") Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void enqueue(ChangeEvent event) {
        String payload = toJson(event);
        String key = event.entityKey();
        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, payload)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[KAFKA-QUEUE] Enqueued key={} dedupKey={} partition={} offset={}",
                    key, event.dedupKey(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueueUnavailableException("Interrupted while enqueueing " + key, e);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            log.error("[KAFKA-QUEUE] Failed to enqueue key={} dedupKey={}: {}", key, event.dedupKey(), e.getMessage());
            throw new QueueUnavailableException("Job queue unavailable for " + key, e);
        }
    }

    private String toJson(ChangeEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Change event is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
