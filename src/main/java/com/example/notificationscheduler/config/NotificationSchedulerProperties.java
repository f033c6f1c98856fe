package com.example.notificationscheduler.config;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.lease.LeaseFailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the notification jobs.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notification-scheduler")
public class NotificationSchedulerProperties {

    /**
     * Shared secret expected in the X-Cron-Secret header. Blank disables every cron endpoint.
     */
    private String cronSecret;

    /**
     * Build identifier echoed in every job response
     */
    private String buildId = "dev";

    /**
     * How often the external trigger invokes each job. Reminder windows are one cadence wide.
     */
    @NotNull
    private Duration triggerCadence = Duration.ofMinutes(5);

    @Valid
    private Reminders reminders = new Reminders();

    @Valid
    private Digest digest = new Digest();

    @Valid
    private Lease lease = new Lease();

    @Valid
    private Retention retention = new Retention();

    @Data
    public static class Reminders {

        /**
         * Minutes before event start at which reminders are considered
         */
        @NotEmpty
        private List<@Min(1) Integer> offsetsMinutes = new ArrayList<>(List.of(30, 120, 1440));
    }

    @Data
    public static class Digest {

        /**
         * Allowed distance in minutes between local time and the preferred digest time
         */
        @Min(0)
        @Max(720)
        private int toleranceMinutes = 15;

        @Min(1)
        private int lookaheadDays = 7;

        @Min(40)
        private int maxBodyLength = 160;

        /**
         * Lease heartbeat interval, in recipients processed
         */
        @Min(1)
        private int leaseExtendEvery = 50;
    }

    @Data
    public static class Lease {

        /**
         * Behavior when the lease store itself is unavailable
         */
        @NotNull
        private LeaseFailurePolicy failurePolicy = LeaseFailurePolicy.FAIL_CLOSED;

        /**
         * Per-job TTL overrides keyed by job name (reminders, digest, ...)
         */
        private Map<String, Duration> ttl = new HashMap<>();
    }

    @Data
    public static class Retention {

        @Min(1)
        private int tokenDeactivateAfterDays = 90;

        @Min(1)
        private int tokenDeleteAfterDays = 180;

        @Min(1)
        private int dedupeRetentionDays = 60;

        /**
         * Days after expiry before a session row is removed
         */
        @Min(0)
        private int sessionGraceDays = 7;

        @AssertTrue(message = "token-delete-after-days must be greater than token-deactivate-after-days")
        public boolean isTokenThresholdsOrdered() {
            return tokenDeleteAfterDays > tokenDeactivateAfterDays;
        }
    }

    public Duration getLeaseTtl(JobType jobType) {
        var override = lease.getTtl().get(jobType.getJobName());
        return override != null ? override : jobType.getDefaultLeaseTtl();
    }

    /**
     * Build id shortened to a 7 character commit hash
     */
    public String getShortBuildId() {
        if (buildId == null || buildId.isBlank()) {
            return "dev";
        }
        return buildId.length() > 7 ? buildId.substring(0, 7) : buildId;
    }

    public boolean isCronSecretConfigured() {
        return cronSecret != null && !cronSecret.isBlank();
    }
}
