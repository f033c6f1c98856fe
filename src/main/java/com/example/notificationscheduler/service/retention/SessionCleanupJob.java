package com.example.notificationscheduler.service.retention;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.SessionCleanupMetrics;
import com.example.notificationscheduler.service.job.CronJob;
import com.example.notificationscheduler.service.job.JobContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionCleanupJob implements CronJob {

    private final RetentionJanitor janitor;

    @Override
    public JobType getJobType() {
        return JobType.SESSION_CLEANUP;
    }

    @Override
    public SessionCleanupMetrics run(JobContext context) {
        return janitor.cleanupSessions();
    }
}
