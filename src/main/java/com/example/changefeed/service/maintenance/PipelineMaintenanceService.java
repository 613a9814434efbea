package com.example.changefeed.service.maintenance;

import com.example.changefeed.lock.EntityLockRegistry;
import com.example.changefeed.model.domain.FailedEvent;
import com.example.changefeed.repository.FailedEventRepository;
import com.example.changefeed.service.PipelineMetrics;
import com.example.changefeed.service.fanout.NotificationFanoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
public class PipelineMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineMaintenanceService.class);

    private final FailedEventRepository failedEventRepository;
    private final PipelineMetrics metrics;
    private final NotificationFanoutManager fanoutManager;
    private final EntityLockRegistry lockRegistry;
    private final Duration deadLetterRetention;
    private final long deadLetterAlertThreshold;

    public PipelineMaintenanceService(FailedEventRepository failedEventRepository,
                                      PipelineMetrics metrics,
                                      NotificationFanoutManager fanoutManager,
                                      EntityLockRegistry lockRegistry,
                                      @Value("${app.maintenance.dead-letter-retention:7d}") Duration deadLetterRetention,
                                      @Value("${app.maintenance.dead-letter-alert-threshold:50}") long deadLetterAlertThreshold) {
        this.failedEventRepository = failedEventRepository;
        this.metrics = metrics;
        this.fanoutManager = fanoutManager;
        this.lockRegistry = lockRegistry;
        this.deadLetterRetention = deadLetterRetention;
        this.deadLetterAlertThreshold = deadLetterAlertThreshold;
    }

    /**
     * Deletes dead letters older than the retention period.
     * Runs daily at 2 AM
     */
    @Scheduled(cron = "${app.maintenance.cleanup-cron:0 0 2 * * *}")
    @Transactional
    public int cleanupOldFailedEvents() {
        logger.info("Starting cleanup of old dead-lettered change events");

        Instant cutoff = Instant.now().minus(deadLetterRetention);
        List<FailedEvent> oldFailedEvents = failedEventRepository.findByCreatedAtBefore(cutoff);

        if (oldFailedEvents.isEmpty()) {
            logger.info("No old dead letters to clean up");
            return 0;
        }
        failedEventRepository.deleteAll(oldFailedEvents);
        logger.info("Cleaned up {} dead letters older than {}", oldFailedEvents.size(), deadLetterRetention);
        return oldFailedEvents.size();
    }

    /**
     * Log pipeline statistics for monitoring
     * Runs every 5 minutes
     */
    @Scheduled(fixedRateString = "${app.maintenance.statistics-rate:300000}")
    public void logPipelineStatistics() {
        try {
            long deadLetters = failedEventRepository.count();
            long recentDeadLetters = failedEventRepository.countByCreatedAtAfter(
                    Instant.now().minus(5, ChronoUnit.MINUTES));

            logger.info("=== PIPELINE STATISTICS ===");
            logger.info("Dead Letters - Total: {}, Recent (5min): {}", deadLetters, recentDeadLetters);
            logger.info("Job Counts - Poisoned: {}, Dead-lettered: {}, Retries: {}",
                    metrics.getPoisonedCount(), metrics.getDeadLetterCount(), metrics.getRetryCount());
            logger.info("Live Delivery - Open channels: {}, Delivery failures: {}, Locked entities: {}",
                    fanoutManager.openChannelCount(), metrics.getDeliveryFailureCount(),
                    lockRegistry.activeEntities());
            logger.info("===========================");

            if (recentDeadLetters > 0) {
                logger.warn("ALERT: {} change event(s) dead-lettered in the last 5 minutes", recentDeadLetters);
            }
            if (deadLetters > deadLetterAlertThreshold) {
                logger.warn("HIGH ALERT: {} dead-lettered change events awaiting inspection", deadLetters);
            }
        } catch (RuntimeException ex) {
            logger.error("Failed to log pipeline statistics: {}", ex.getMessage(), ex);
        }
    }
}
