package com.example.changefeed.queue.kafka;

import com.example.changefeed.exception.LockTimeoutException;
import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.service.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

import java.time.Duration;

/**
 * Kafka backing for the change job queue. Jobs are keyed by entity, so one
 * entity always lands on one partition and is consumed in order. Failed jobs
 * are retried in place (blocking the partition) with exponential backoff,
 * then published to the dead-letter topic.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.queue.type", havingValue = "kafka", matchIfMissing = true)
public class KafkaQueueConfig {

    public static final String CONTAINER_FACTORY = "changeJobContainerFactory";

    @Bean
    public NewTopic changeEventsTopic(@Value("${app.kafka.topics.change-events}") String topic,
                                      @Value("${app.kafka.partitions:12}") int partitions,
                                      @Value("${app.kafka.replicas:1}") int replicas) {
        return TopicBuilder.name(topic).partitions(partitions).replicas(replicas).build();
    }

    @Bean
    public NewTopic changeEventsDeadLetterTopic(@Value("${app.kafka.topics.change-events-dlt}") String topic,
                                                @Value("${app.kafka.replicas:1}") int replicas) {
        return TopicBuilder.name(topic).partitions(1).replicas(replicas).build();
    }

    @Bean(name = CONTAINER_FACTORY)
    public ConcurrentKafkaListenerContainerFactory<String, String> changeJobContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory,
            KafkaTemplate<String, String> kafkaTemplate,
            PipelineMetrics metrics,
            @Value("${app.kafka.topics.change-events-dlt}") String deadLetterTopic,
            @Value("${app.queue.workers:5}") int workers,
            @Value("${app.queue.max-attempts:5}") int maxAttempts,
            @Value("${app.queue.retry.initial-interval:1s}") Duration initialInterval,
            @Value("${app.queue.retry.multiplier:2.0}") double multiplier,
            @Value("${app.queue.retry.max-interval:30s}") Duration maxInterval) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> genericFactory =
                new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(genericFactory, consumerFactory);
        genericFactory.setConcurrency(workers);
        genericFactory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);

        // partition -1 lets the producer pick; the DLT has fewer partitions than the source topic
        DeadLetterPublishingRecoverer recoverer = new DeadLetterPublishingRecoverer(kafkaTemplate,
                (record, ex) -> new TopicPartition(deadLetterTopic, -1));

        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(maxAttempts - 1);
        backOff.setInitialInterval(initialInterval.toMillis());
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxInterval.toMillis());

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.addNotRetryableExceptions(PoisonedJobException.class);
        errorHandler.setCommitRecovered(true);
        errorHandler.setRetryListeners((record, ex, deliveryAttempt) -> {
            metrics.recordRetry();
            if (hasCause(ex, LockTimeoutException.class)) {
                metrics.recordLockTimeout();
            }
            log.warn("[KAFKA-QUEUE] Attempt {} failed for key={} offset={}: {}",
                    deliveryAttempt, record.key(), record.offset(), ex.getMessage());
        });
        genericFactory.setCommonErrorHandler(errorHandler);

        @SuppressWarnings("unchecked")
        ConcurrentKafkaListenerContainerFactory<String, String> typedFactory =
                (ConcurrentKafkaListenerContainerFactory<String, String>) (ConcurrentKafkaListenerContainerFactory<?, ?>) genericFactory;
        return typedFactory;
    }

    static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
