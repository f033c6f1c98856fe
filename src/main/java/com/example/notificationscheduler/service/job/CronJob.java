package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.JobMetrics;

/**
 * A job triggered through a cron endpoint.
 * <p>
 * Implementations should:
 * - Be stateless
 * - Let unexpected exceptions propagate (the runner turns them into an error envelope)
 * - Not acquire or release leases (handled by the runner)
 */
public interface CronJob {

    JobType getJobType();

    /**
     * Execute one run
     *
     * @param context lease and timing of the current invocation
     * @return counters reported in the response envelope
     */
    JobMetrics run(JobContext context);
}
