package com.example.notificationscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response envelope shared by every cron endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Cron job result envelope")
public class CronJobResponse {

    private boolean ok;

    @Schema(example = "reminders")
    private String job;

    /**
     * Completion time, ISO-8601 UTC
     */
    private Instant ts;

    private long durationMs;

    private String buildId;

    private Boolean skipped;

    @Schema(description = "Skip reason", example = "LEASE_HELD")
    private String reason;

    private JobMetrics metrics;

    @Schema(description = "Stable error code", example = "REMINDERS_RUN_FAILED")
    private String error;

    // health check only
    private String message;
    private String db;
    private String env;
}
