package com.example.notificationscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenCleanupMetrics implements JobMetrics {

    private int deactivated;
    private int deleted;
    private Thresholds thresholds;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private int deactivateAfterDays;
        private int deleteAfterDays;
    }
}
