package com.example.notificationscheduler.service.lease;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Result of a lease acquisition attempt.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class LeaseAcquisition {

    private final String jobName;
    private final LeaseStatus status;
    private final String ownerId;
    private final Instant lockedUntil;

    public static LeaseAcquisition acquired(String jobName, String ownerId, Instant lockedUntil) {
        return new LeaseAcquisition(jobName, LeaseStatus.ACQUIRED, ownerId, lockedUntil);
    }

    public static LeaseAcquisition unguarded(String jobName) {
        return new LeaseAcquisition(jobName, LeaseStatus.UNGUARDED, null, null);
    }

    public static LeaseAcquisition notAcquired(String jobName, LeaseStatus status) {
        return new LeaseAcquisition(jobName, status, null, null);
    }

    /**
     * True when the job may run, either under a held lease or unguarded by policy.
     */
    public boolean isAcquired() {
        return status.allowsRun();
    }

    /**
     * True only when a lease row is actually owned by this run.
     */
    public boolean isHeld() {
        return status == LeaseStatus.ACQUIRED;
    }

    public String getReason() {
        return status.getReasonCode();
    }
}
