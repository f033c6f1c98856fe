package com.example.notificationscheduler.dto;

import lombok.Data;

/**
 * Counters for one reminders run
 */
@Data
public class ReminderRunMetrics implements JobMetrics {

    /**
     * Recipient/offset pairs examined
     */
    private int processed;
    private final Sent sent = new Sent();
    private final Skipped skipped = new Skipped();

    @Data
    public static class Sent {
        private int inApp;
        private int push;
    }

    @Data
    public static class Skipped {
        private int dedupe;
        private int prefs;
        private int quietHours;
        private int noToken;
    }
}
