package com.example.notificationscheduler.dto;

import lombok.Data;

/**
 * Counters for one digest run
 */
@Data
public class DigestRunMetrics implements JobMetrics {

    private int eligibleUsers;
    private final Sent sent = new Sent();
    private final Skipped skipped = new Skipped();

    @Data
    public static class Sent {
        private int inApp;
        private int push;
    }

    @Data
    public static class Skipped {
        private int window;
        private int day;
        private int dedupe;
        private int quietHours;
        private int noToken;
    }
}
