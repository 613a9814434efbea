package com.example.changefeed.service.history;

import com.example.changefeed.exception.PoisonedJobException;
import com.example.changefeed.exception.RetryableJobException;
import com.example.changefeed.lock.EntityKey;
import com.example.changefeed.lock.EntityLease;
import com.example.changefeed.lock.EntityLockRegistry;
import com.example.changefeed.model.domain.ChangeHistoryRecord;
import com.example.changefeed.model.dto.ChangeEvent;
import com.example.changefeed.model.dto.FieldChange;
import com.example.changefeed.repository.ChangeHistoryRecordRepository;
import com.example.changefeed.service.user.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends change history records, serialized per entity.
 *
 * The entity lease is held for the whole transaction and verified right
 * before commit, so records of one entity are written one job at a time even
 * with several workers and redeliveries racing. Different entities never
 * wait on each other.
 */
@Slf4j
@Service
public class ChangeHistoryWriter {

    private final ChangeHistoryRecordRepository historyRepository;
    private final UserDirectory userDirectory;
    private final EntityLockRegistry lockRegistry;
    private final ChangeEventValidator validator;
    private final TransactionTemplate transactionTemplate;
    private final Duration lockWait;

    public ChangeHistoryWriter(ChangeHistoryRecordRepository historyRepository,
                               UserDirectory userDirectory,
                               EntityLockRegistry lockRegistry,
                               ChangeEventValidator validator,
                               PlatformTransactionManager transactionManager,
                               @Value("${app.history.lock-wait:10s}") Duration lockWait) {
        this.historyRepository = historyRepository;
        this.userDirectory = userDirectory;
        this.lockRegistry = lockRegistry;
        this.validator = validator;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.lockWait = lockWait;
    }

    /**
     * Records the field changes of one event.
     *
     * @throws PoisonedJobException   if the event is structurally invalid
     * @throws RetryableJobException  on storage failures or lock timeouts
     */
    public WriteOutcome process(ChangeEvent event) {
        validator.validate(event).ifPresent(reason -> {
            throw new PoisonedJobException("Invalid change event " + describe(event) + ": " + reason);
        });

        EntityKey key = EntityKey.of(event);
        try (EntityLease lease = lockRegistry.acquire(key, lockWait)) {
            WriteOutcome outcome = transactionTemplate.execute(status -> append(event, lease));
            log.info("[HISTORY] {} ({} field change(s)) dedupKey={} -> {}", key, event.fieldChanges().size(),
                    event.dedupKey(), outcome);
            return outcome;
        } catch (DataIntegrityViolationException e) {
            // A concurrent delivery of the same event won the unique (dedup_key, field_position) race
            if (isRecorded(event.dedupKey())) {
                log.info("[HISTORY] {} dedupKey={} committed concurrently, treating as duplicate", key, event.dedupKey());
                return WriteOutcome.DUPLICATE;
            }
            throw new RetryableJobException("Integrity failure writing history for " + key, e);
        } catch (RetryableJobException | PoisonedJobException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.warn("[HISTORY] Storage failure for {} dedupKey={}: {}", key, event.dedupKey(), e.getMessage());
            throw new RetryableJobException("Storage unavailable while writing history for " + key, e);
        }
    }

    private WriteOutcome append(ChangeEvent event, EntityLease lease) {
        if (historyRepository.existsByDedupKey(event.dedupKey())) {
            log.debug("Dedup key {} already recorded, skipping", event.dedupKey());
            return WriteOutcome.DUPLICATE;
        }

        String username = userDirectory.findUsername(event.actorUserId()).orElse(null);
        if (username == null) {
            log.warn("Actor {} of {} not found in user directory", event.actorUserId(), event.entityKey());
        }

        List<ChangeHistoryRecord> records = new ArrayList<>();
        List<FieldChange> changes = event.fieldChanges();
        for (int position = 0; position < changes.size(); position++) {
            FieldChange change = changes.get(position);
            if (change.isNoOp()) {
                continue;
            }
            records.add(new ChangeHistoryRecord(
                    event.entityType(),
                    event.entityId(),
                    change.oldValue() == null ? null : singleField(change.field(), change.oldValue()),
                    singleField(change.field(), change.newValue()),
                    event.actorUserId(),
                    username,
                    event.dedupKey(),
                    position));
        }
        if (records.isEmpty()) {
            return WriteOutcome.NO_CHANGES;
        }

        historyRepository.saveAll(records);
        historyRepository.flush();
        lease.verifyHeld();
        return WriteOutcome.COMMITTED;
    }

    private boolean isRecorded(String dedupKey) {
        try {
            return historyRepository.existsByDedupKey(dedupKey);
        } catch (DataAccessException e) {
            log.warn("[HISTORY] Could not check dedupKey={} after integrity failure: {}", dedupKey, e.getMessage());
            return false;
        }
    }

    private static Map<String, Object> singleField(String field, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(field, value);
        return map;
    }

    private static String describe(ChangeEvent event) {
        return event == null ? "<null>" : event.entityKey() + " dedupKey=" + event.dedupKey();
    }
}
