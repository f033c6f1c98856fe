package com.example.notificationscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCleanupMetrics implements JobMetrics {

    private int deleted;
    private Thresholds thresholds;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private int deleteAfterExpiryDays;
    }
}
