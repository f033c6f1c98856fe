package com.example.notificationscheduler.service.lease;

/**
 * What a lease-guarded job does when the lease store cannot be reached.
 */
public enum LeaseFailurePolicy {
    /**
     * Skip the run. Safe default: a broken lease table never causes duplicate runs.
     */
    FAIL_CLOSED,
    /**
     * Run without a lease. Dedup still prevents duplicate notifications.
     */
    FAIL_OPEN
}
