package com.example.notificationscheduler.service.retention;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.repository.DeliveryLogRepository;
import com.example.notificationscheduler.domain.repository.PushTokenRepository;
import com.example.notificationscheduler.domain.repository.UserSessionRepository;
import com.example.notificationscheduler.dto.DedupeCleanupMetrics;
import com.example.notificationscheduler.dto.SessionCleanupMetrics;
import com.example.notificationscheduler.dto.TokenCleanupMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Bulk retention sweeps. Each sweep is a set of idempotent conditional statements,
 * safe to run concurrently and repeatedly without a lease.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionJanitor {

    private final PushTokenRepository pushTokenRepository;
    private final DeliveryLogRepository deliveryLogRepository;
    private final UserSessionRepository userSessionRepository;
    private final NotificationSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Delete long-inactive tokens, then deactivate tokens unseen for the shorter window.
     */
    public TokenCleanupMetrics cleanupTokens() {
        var retention = properties.getRetention();
        var now = clock.instant();
        var deleteCutoff = now.minus(Duration.ofDays(retention.getTokenDeleteAfterDays()));
        var deactivateCutoff = now.minus(Duration.ofDays(retention.getTokenDeactivateAfterDays()));

        var deleted = pushTokenRepository.deleteInactiveUnseenSince(deleteCutoff);
        var deactivated = pushTokenRepository.deactivateUnseenSince(deactivateCutoff, now);

        log.info("[Retention] tokens: deactivated={} deleted={}", deactivated, deleted);
        metricsConfig.recordRetentionRows(JobType.TOKEN_CLEANUP, "deleted", deleted);
        metricsConfig.recordRetentionRows(JobType.TOKEN_CLEANUP, "deactivated", deactivated);

        return TokenCleanupMetrics.builder()
                .deactivated(deactivated)
                .deleted(deleted)
                .thresholds(new TokenCleanupMetrics.Thresholds(
                        retention.getTokenDeactivateAfterDays(), retention.getTokenDeleteAfterDays()))
                .build();
    }

    public DedupeCleanupMetrics cleanupDeliveryLog() {
        var days = properties.getRetention().getDedupeRetentionDays();
        var cutoff = clock.instant().minus(Duration.ofDays(days));

        var deleted = deliveryLogRepository.deleteSentBefore(cutoff);

        log.info("[Retention] delivery log: deleted={} (older than {} days)", deleted, days);
        metricsConfig.recordRetentionRows(JobType.DEDUPE_CLEANUP, "deleted", deleted);

        return DedupeCleanupMetrics.builder()
                .deleted(deleted)
                .thresholds(new DedupeCleanupMetrics.Thresholds(days))
                .build();
    }

    public SessionCleanupMetrics cleanupSessions() {
        var days = properties.getRetention().getSessionGraceDays();
        var cutoff = clock.instant().minus(Duration.ofDays(days));

        var deleted = userSessionRepository.deleteExpiredBefore(cutoff);

        log.info("[Retention] sessions: deleted={} (expired more than {} days ago)", deleted, days);
        metricsConfig.recordRetentionRows(JobType.SESSION_CLEANUP, "deleted", deleted);

        return SessionCleanupMetrics.builder()
                .deleted(deleted)
                .thresholds(new SessionCleanupMetrics.Thresholds(days))
                .build();
    }
}
