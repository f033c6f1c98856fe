package com.example.notificationscheduler.service.lease;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.repository.JobLeaseRepository;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Distributed mutex with a TTL per job name, backed by the job_lease table.
 * <p>
 * Acquisition is a single conditional upsert; a lease that is never released
 * simply expires. Infrastructure errors are reported as {@link LeaseStatus#ERROR}
 * and resolved by the configured {@link LeaseFailurePolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLeaseManager {

    private final JobLeaseRepository leaseRepository;
    private final NotificationSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    public LeaseAcquisition acquire(String jobName, Duration ttl) {
        var ownerId = newOwnerId();
        var now = clock.instant();
        var lockedUntil = now.plus(ttl);

        try {
            var storedOwner = leaseRepository.tryAcquire(jobName, ownerId, now, lockedUntil);

            if (storedOwner.isEmpty()) {
                logCurrentHolder(jobName);
                metricsConfig.recordLeaseOutcome(jobName, "held");
                return LeaseAcquisition.notAcquired(jobName, LeaseStatus.HELD);
            }

            if (!ownerId.equals(storedOwner.get())) {
                log.warn("[Lease] {}: OWNER_MISMATCH expected={} stored={}", jobName, ownerId, storedOwner.get());
                metricsConfig.recordLeaseOutcome(jobName, "owner_mismatch");
                return LeaseAcquisition.notAcquired(jobName, LeaseStatus.OWNER_MISMATCH);
            }

            log.info("[Lease] {}: ACQUIRED owner={} until={}", jobName, ownerId, lockedUntil);
            metricsConfig.recordLeaseOutcome(jobName, "acquired");
            return LeaseAcquisition.acquired(jobName, ownerId, lockedUntil);

        } catch (DataAccessException e) {
            log.error("[Lease] {}: LEASE_ERROR {}", jobName, e.getMessage(), e);
            metricsConfig.recordLeaseOutcome(jobName, "error");
            slackAlertService.sendLeaseErrorAlert(jobName, properties.getLease().getFailurePolicy(), e);

            if (properties.getLease().getFailurePolicy() == LeaseFailurePolicy.FAIL_OPEN) {
                log.warn("[Lease] {}: running UNGUARDED (failure policy FAIL_OPEN)", jobName);
                return LeaseAcquisition.unguarded(jobName);
            }
            return LeaseAcquisition.notAcquired(jobName, LeaseStatus.ERROR);
        }
    }

    /**
     * Release a lease early. Never throws.
     */
    public void release(LeaseAcquisition lease) {
        if (lease == null || !lease.isHeld()) {
            return;
        }
        release(lease.getJobName(), lease.getOwnerId());
    }

    public void release(String jobName, String ownerId) {
        try {
            var deleted = leaseRepository.deleteByJobNameAndOwnerId(jobName, ownerId);
            if (deleted == 0) {
                log.info("[Lease] {}: release was a no-op, lease expired or taken over (owner={})", jobName, ownerId);
            } else {
                log.info("[Lease] {}: RELEASED owner={}", jobName, ownerId);
            }
        } catch (DataAccessException e) {
            log.warn("[Lease] {}: release failed for owner={}, lease will expire on its own: {}",
                    jobName, ownerId, e.getMessage());
        }
    }

    /**
     * Push the lease expiry to now + additionalTtl.
     *
     * @return true if the caller still holds the lease and it was extended
     */
    public boolean extend(LeaseAcquisition lease, Duration additionalTtl) {
        if (lease == null || !lease.isHeld()) {
            return false;
        }
        return extend(lease.getJobName(), lease.getOwnerId(), additionalTtl);
    }

    public boolean extend(String jobName, String ownerId, Duration additionalTtl) {
        try {
            var lockedUntil = clock.instant().plus(additionalTtl);
            var updated = leaseRepository.extendLease(jobName, ownerId, lockedUntil);
            if (updated == 0) {
                log.warn("[Lease] {}: extend failed, owner {} no longer holds the lease", jobName, ownerId);
                return false;
            }
            log.debug("[Lease] {}: EXTENDED owner={} until={}", jobName, ownerId, lockedUntil);
            return true;
        } catch (DataAccessException e) {
            log.warn("[Lease] {}: extend failed for owner={}: {}", jobName, ownerId, e.getMessage());
            return false;
        }
    }

    private void logCurrentHolder(String jobName) {
        try {
            leaseRepository.findById(jobName).ifPresentOrElse(
                    lease -> log.info("[Lease] {}: LEASE_HELD by owner={} remaining={}s",
                            jobName, lease.getOwnerId(), lease.remaining(clock.instant()).toSeconds()),
                    () -> log.info("[Lease] {}: LEASE_HELD", jobName));
        } catch (DataAccessException e) {
            log.info("[Lease] {}: LEASE_HELD (holder lookup failed: {})", jobName, e.getMessage());
        }
    }

    /**
     * Owner ids are base36 epoch millis plus a random suffix.
     */
    String newOwnerId() {
        var random = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return Long.toString(clock.millis(), 36) + "-" + random.substring(0, Math.min(8, random.length()));
    }
}
