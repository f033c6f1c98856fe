package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Defines the jobs reachable through the cron endpoints.
 * Each job type maps to a specific {@code CronJob} implementation.
 */
@Getter
@RequiredArgsConstructor
public enum JobType {

    /**
     * Event reminders for events entering an offset window
     */
    REMINDERS("reminders", true, Duration.ofMinutes(3), "REMINDERS_RUN_FAILED"),

    /**
     * Daily digest at each recipient's local digest time
     */
    DIGEST("digest", true, Duration.ofMinutes(5), "DIGEST_RUN_FAILED"),

    /**
     * Deactivate stale push tokens and delete long-inactive ones
     */
    TOKEN_CLEANUP("token_cleanup", false, Duration.ofMinutes(2), "TOKEN_CLEANUP_FAILED"),

    /**
     * Delete old delivery log entries
     */
    DEDUPE_CLEANUP("dedupe_cleanup", false, Duration.ofMinutes(2), "DEDUPE_CLEANUP_FAILED"),

    /**
     * Delete sessions well past their expiry
     */
    SESSION_CLEANUP("session_cleanup", false, Duration.ofMinutes(2), "SESSION_CLEANUP_FAILED");

    /**
     * Job name used for the lease row and in responses
     */
    private final String jobName;

    /**
     * Whether runs must hold the job lease. Cleanup jobs are idempotent bulk
     * statements and run unlocked.
     */
    private final boolean leaseRequired;

    private final Duration defaultLeaseTtl;

    /**
     * Stable error code reported when a run fails
     */
    private final String failureCode;

    /**
     * Find JobType by its job name
     */
    public static JobType fromJobName(String jobName) {
        for (var type : values()) {
            if (type.getJobName().equals(jobName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job name: " + jobName);
    }
}
