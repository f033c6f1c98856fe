package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.lease.JobLeaseManager;
import com.example.notificationscheduler.service.lease.LeaseAcquisition;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-invocation state handed to a {@link CronJob}.
 */
@Getter
public class JobContext {

    private final JobType jobType;
    private final Instant startedAt;
    private final LeaseAcquisition lease;
    private final Duration leaseTtl;
    private final JobLeaseManager leaseManager;

    public JobContext(JobType jobType, Instant startedAt, LeaseAcquisition lease,
                      Duration leaseTtl, JobLeaseManager leaseManager) {
        this.jobType = jobType;
        this.startedAt = startedAt;
        this.lease = lease;
        this.leaseTtl = leaseTtl;
        this.leaseManager = leaseManager;
    }

    /**
     * Context for a job that runs without a lease.
     */
    public static JobContext unleased(JobType jobType, Instant startedAt) {
        return new JobContext(jobType, startedAt, null, null, null);
    }

    /**
     * Heartbeat: push the lease expiry one TTL past now. No-op without a held lease.
     *
     * @return true if the lease was extended
     */
    public boolean extendLease() {
        if (lease == null || !lease.isHeld() || leaseManager == null) {
            return false;
        }
        return leaseManager.extend(lease, leaseTtl);
    }
}
