package com.example.notificationscheduler.service.retention;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.TokenCleanupMetrics;
import com.example.notificationscheduler.service.job.CronJob;
import com.example.notificationscheduler.service.job.JobContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TokenCleanupJob implements CronJob {

    private final RetentionJanitor janitor;

    @Override
    public JobType getJobType() {
        return JobType.TOKEN_CLEANUP;
    }

    @Override
    public TokenCleanupMetrics run(JobContext context) {
        return janitor.cleanupTokens();
    }
}
