package com.example.notificationscheduler.dto;

/**
 * Marker for the job-specific metrics block of a {@link CronJobResponse}.
 */
public interface JobMetrics {
}
