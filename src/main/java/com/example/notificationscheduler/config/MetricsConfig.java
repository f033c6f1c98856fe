package com.example.notificationscheduler.config;

import com.example.notificationscheduler.domain.enums.JobType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for job runs, leases and deliveries.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job run duration by job and outcome
 * - Lease acquisition outcomes
 * - Per-reason recipient skips
 * - In-app and push deliveries
 * - Timezone fallbacks
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job run time; outcome is completed, skipped or failed
     */
    public void recordJobRun(Timer.Sample sample, JobType jobType, String outcome) {
        sample.stop(Timer.builder("notification_scheduler_job_duration")
                .tag("job", jobType.getJobName())
                .tag("outcome", outcome)
                .description("Cron job run time")
                .register(meterRegistry));
    }

    public void recordLeaseOutcome(String jobName, String outcome) {
        meterRegistry.counter("notification_scheduler_lease_outcomes",
                "job", jobName,
                "outcome", outcome
        ).increment();
    }

    public void recordSkip(JobType jobType, String reason) {
        meterRegistry.counter("notification_scheduler_recipient_skips",
                "job", jobType.getJobName(),
                "reason", reason
        ).increment();
    }

    /**
     * Record a delivery; channel is in_app or push
     */
    public void recordDelivery(JobType jobType, String channel) {
        meterRegistry.counter("notification_scheduler_deliveries",
                "job", jobType.getJobName(),
                "channel", channel
        ).increment();
    }

    public void recordPushOutcome(String outcome, int count) {
        if (count <= 0) {
            return;
        }
        meterRegistry.counter("notification_scheduler_push_messages",
                "outcome", outcome
        ).increment(count);
    }

    public void recordTimezoneFallback() {
        meterRegistry.counter("notification_scheduler_timezone_fallbacks").increment();
    }

    public void recordRetentionRows(JobType jobType, String action, int rows) {
        meterRegistry.counter("notification_scheduler_retention_rows",
                "job", jobType.getJobName(),
                "action", action
        ).increment(rows);
    }
}
