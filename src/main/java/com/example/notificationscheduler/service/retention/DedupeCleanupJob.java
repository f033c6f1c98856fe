package com.example.notificationscheduler.service.retention;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.DedupeCleanupMetrics;
import com.example.notificationscheduler.service.job.CronJob;
import com.example.notificationscheduler.service.job.JobContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DedupeCleanupJob implements CronJob {

    private final RetentionJanitor janitor;

    @Override
    public JobType getJobType() {
        return JobType.DEDUPE_CLEANUP;
    }

    @Override
    public DedupeCleanupMetrics run(JobContext context) {
        return janitor.cleanupDeliveryLog();
    }
}
