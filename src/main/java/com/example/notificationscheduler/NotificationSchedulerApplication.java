package com.example.notificationscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Notification Scheduler Application
 * <p>
 * Runs the reminder, digest and retention jobs behind authenticated cron endpoints.
 * Jobs are triggered externally; there is no in-process scheduler.
 * <p>
 * Features:
 * - Lease-based job locking shared across all runner instances
 * - Exactly-once recording of each notification occasion
 * - Recipient-timezone digest windows and quiet-hours push suppression
 * - Chunked Expo push delivery with dead-device token deactivation
 * - Slack alerting for failed runs
 */
@SpringBootApplication
public class NotificationSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationSchedulerApplication.class, args);
    }
}
