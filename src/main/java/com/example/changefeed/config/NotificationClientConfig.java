package com.example.changefeed.config;

import com.example.changefeed.client.NotificationPayloadParser;
import com.example.changefeed.client.NotificationStreamConsumer;
import com.example.changefeed.client.ReconnectScheduler;
import com.example.changefeed.client.RestTemplateBackfillClient;
import com.example.changefeed.client.RestTemplateSseTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires a {@link NotificationStreamConsumer} that follows the notification
 * stream of another instance. Enabled by setting {@code app.client.base-url}.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.client", name = "base-url")
public class NotificationClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(NotificationClientConfig.class);

    @Bean
    @Qualifier("notificationStreamRestTemplate")
    public RestTemplate notificationStreamRestTemplate(RestTemplateBuilder builder,
                                                       @Value("${app.client.read-timeout:90s}") Duration readTimeout) {
        // the server heartbeat keeps the read timeout from firing on an idle stream
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService notificationStreamExecutor() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "notification-stream");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public NotificationStreamConsumer notificationStreamConsumer(
            @Qualifier("notificationStreamRestTemplate") RestTemplate restTemplate,
            ScheduledExecutorService notificationStreamExecutor,
            RetryRegistry retryRegistry,
            ObjectMapper objectMapper,
            @Value("${app.client.base-url}") String baseUrl,
            @Value("${app.client.user-id}") String userId) {
        logger.info("Following notification stream of user {} at {}", userId, baseUrl);
        UriComponentsBuilder base = UriComponentsBuilder.fromHttpUrl(baseUrl).path("/api/v1/notifications");
        RestTemplateSseTransport transport = new RestTemplateSseTransport(
                restTemplate, base.cloneBuilder().path("/stream").build().toUri(), userId);
        RestTemplateBackfillClient backfill = new RestTemplateBackfillClient(
                restTemplate, base.cloneBuilder().path("/since").build().toUri(), userId,
                retryRegistry.retry("notificationBackfill"));
        return new NotificationStreamConsumer(
                transport,
                backfill,
                ReconnectScheduler.using(notificationStreamExecutor),
                new NotificationPayloadParser(objectMapper),
                notification -> logger.info("🔔 [{}] {}", notification.type(), notification.message()));
    }
}
