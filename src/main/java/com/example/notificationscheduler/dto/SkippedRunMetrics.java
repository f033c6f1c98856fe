package com.example.notificationscheduler.dto;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

/**
 * Metrics of a run skipped before doing any work. Serializes as an empty object.
 */
@JsonAutoDetect
public final class SkippedRunMetrics implements JobMetrics {

    public static final SkippedRunMetrics INSTANCE = new SkippedRunMetrics();

    private SkippedRunMetrics() {
    }
}
