package com.example.notificationscheduler.service.dedup;

import com.example.notificationscheduler.domain.entity.DeliveryLogEntry;
import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.repository.DeliveryLogRepository;
import com.example.notificationscheduler.domain.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.time.Clock;

/**
 * Idempotency ledger for notification occasions.
 * <p>
 * The unique (user_id, dedupe_key) constraint decides who wins a race: the
 * in-app notification and its ledger row commit together or not at all.
 */
@Slf4j
@Service
public class DeliveryDedupStore {

    static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final DeliveryLogRepository deliveryLogRepository;
    private final NotificationRepository notificationRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DeliveryDedupStore(DeliveryLogRepository deliveryLogRepository,
                              NotificationRepository notificationRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.deliveryLogRepository = deliveryLogRepository;
        this.notificationRepository = notificationRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public static String reminderKey(String eventId, String recipientId, int offsetMinutes) {
        return "reminder:" + eventId + ":" + recipientId + ":" + offsetMinutes;
    }

    public static String digestKey(String recipientId, String localDate) {
        return "digest:" + recipientId + ":" + localDate;
    }

    /**
     * Fast-path check. A false result does not guarantee {@link #tryRecord} will succeed.
     */
    public boolean isRecorded(String recipientId, String dedupeKey) {
        return deliveryLogRepository.existsByUserIdAndDedupeKey(recipientId, dedupeKey);
    }

    /**
     * Persist the in-app notification together with its ledger row.
     *
     * @return true if the occasion was already recorded and nothing was written
     */
    public boolean tryRecord(String recipientId, String dedupeKey, Notification notification) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                notificationRepository.save(notification);
                deliveryLogRepository.saveAndFlush(DeliveryLogEntry.builder()
                        .userId(recipientId)
                        .dedupeKey(dedupeKey)
                        .sentAt(clock.instant())
                        .build());
            });
            return false;
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                log.debug("[Dedup] {} already recorded for {}", dedupeKey, recipientId);
                return true;
            }
            throw e;
        }
    }

    static boolean isUniqueViolation(Throwable error) {
        if (error instanceof DuplicateKeyException) {
            return true;
        }
        var cause = error;
        while (cause != null) {
            if (cause instanceof SQLException sqlException
                    && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
