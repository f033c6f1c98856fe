package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.enums.JobRunState;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.CronJobResponse;
import com.example.notificationscheduler.dto.JobMetrics;
import com.example.notificationscheduler.dto.SkippedRunMetrics;
import com.example.notificationscheduler.exception.JobExecutionException;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.lease.JobLeaseManager;
import com.example.notificationscheduler.service.lease.LeaseAcquisition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Runs a cron job through its lifecycle and builds the response envelope.
 * <p>
 * Flow:
 * 1. Acquire the job lease (lease-guarded jobs only); not acquired → skipped, ok=true
 * 2. Run the job on the calling thread
 * 3. Unexpected exception → ok=false with the job's error code, Slack alert
 * 4. Release the lease in every case
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronJobRunner {

    private final CronJobRegistry jobRegistry;
    private final JobLeaseManager leaseManager;
    private final NotificationSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    public CronJobResponse run(JobType jobType) {
        var job = jobRegistry.getJobOrThrow(jobType);
        var startedAt = clock.instant();
        var sample = metricsConfig.startJobTimer();
        var state = new RunState(jobType);

        log.info("[Cron] {}: START", jobType.getJobName());

        LeaseAcquisition lease = null;
        try {
            JobContext context;
            if (jobType.isLeaseRequired()) {
                state.moveTo(JobRunState.LEASE_ATTEMPTED);
                var ttl = properties.getLeaseTtl(jobType);
                lease = leaseManager.acquire(jobType.getJobName(), ttl);

                if (!lease.isAcquired()) {
                    state.moveTo(JobRunState.SKIPPED);
                    log.info("[Cron] {}: SKIPPED ({})", jobType.getJobName(), lease.getReason());
                    metricsConfig.recordJobRun(sample, jobType, "skipped");
                    return skippedResponse(jobType, startedAt, lease.getReason());
                }
                context = new JobContext(jobType, startedAt, lease, ttl, leaseManager);
            } else {
                context = JobContext.unleased(jobType, startedAt);
            }

            state.moveTo(JobRunState.RUNNING);
            JobMetrics metrics = job.run(context);
            state.moveTo(JobRunState.COMPLETED);

            log.info("[Cron] {}: END in {}ms | {}", jobType.getJobName(), elapsedMs(startedAt), metrics);
            metricsConfig.recordJobRun(sample, jobType, "completed");
            return baseResponse(jobType, startedAt, true)
                    .metrics(metrics)
                    .build();

        } catch (RuntimeException e) {
            var failure = e instanceof JobExecutionException jobException ? jobException : new JobExecutionException(jobType, e);
            state.fail();
            log.error("[Cron] {}: ERROR {}", jobType.getJobName(), failure.getErrorCode(), e);
            metricsConfig.recordJobRun(sample, jobType, "failed");
            slackAlertService.sendJobFailureAlert(jobType, failure.getErrorCode(), e);
            return baseResponse(jobType, startedAt, false)
                    .error(failure.getErrorCode())
                    .build();

        } finally {
            leaseManager.release(lease);
        }
    }

    private CronJobResponse skippedResponse(JobType jobType, Instant startedAt, String reason) {
        return baseResponse(jobType, startedAt, true)
                .skipped(true)
                .reason(reason)
                .metrics(SkippedRunMetrics.INSTANCE)
                .build();
    }

    private CronJobResponse.CronJobResponseBuilder baseResponse(JobType jobType, Instant startedAt, boolean ok) {
        return CronJobResponse.builder()
                .ok(ok)
                .job(jobType.getJobName())
                .ts(clock.instant())
                .durationMs(elapsedMs(startedAt))
                .buildId(properties.getShortBuildId());
    }

    private long elapsedMs(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }

    /**
     * Tracks the run state and rejects illegal transitions.
     */
    private static final class RunState {

        private final JobType jobType;
        private JobRunState current = JobRunState.NOT_RUN;

        private RunState(JobType jobType) {
            this.jobType = jobType;
        }

        private void moveTo(JobRunState next) {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal run state transition for " + jobType.getJobName()
                        + ": " + current + " -> " + next);
            }
            log.debug("[Cron] {}: {} -> {}", jobType.getJobName(), current.getCode(), next.getCode());
            current = next;
        }

        /**
         * A failure can end the run from any non-terminal state.
         */
        private void fail() {
            if (current.canTransitionTo(JobRunState.FAILED)) {
                moveTo(JobRunState.FAILED);
            } else {
                log.debug("[Cron] {}: {} -> {}", jobType.getJobName(), current.getCode(), JobRunState.FAILED.getCode());
                current = JobRunState.FAILED;
            }
        }
    }
}
