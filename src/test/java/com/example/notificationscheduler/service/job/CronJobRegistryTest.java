package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.JobMetrics;
import com.example.notificationscheduler.dto.SkippedRunMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CronJobRegistry Tests")
class CronJobRegistryTest {

    private static CronJob jobFor(JobType type) {
        return new CronJob() {
            @Override
            public JobType getJobType() {
                return type;
            }

            @Override
            public JobMetrics run(JobContext context) {
                return SkippedRunMetrics.INSTANCE;
            }
        };
    }

    @Test
    @DisplayName("Should register jobs by type")
    void shouldRegisterJobs() {
        var reminders = jobFor(JobType.REMINDERS);
        var registry = new CronJobRegistry(List.of(reminders, jobFor(JobType.DIGEST)));

        registry.initialize();

        assertThat(registry.getJobOrThrow(JobType.REMINDERS)).isSameAs(reminders);
        assertThat(registry.getRegisteredTypes()).containsExactlyInAnyOrder(JobType.REMINDERS, JobType.DIGEST);
        assertThat(registry.getJob(JobType.TOKEN_CLEANUP)).isEmpty();
    }

    @Test
    @DisplayName("Should reject two jobs for the same type")
    void shouldRejectDuplicates() {
        var registry = new CronJobRegistry(List.of(jobFor(JobType.DIGEST), jobFor(JobType.DIGEST)));

        assertThatThrownBy(registry::initialize)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate cron job");
    }

    @Test
    @DisplayName("Should throw for an unregistered type")
    void shouldThrowForMissingJob() {
        var registry = new CronJobRegistry(List.of());
        registry.initialize();

        assertThatThrownBy(() -> registry.getJobOrThrow(JobType.SESSION_CLEANUP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SESSION_CLEANUP");
    }
}
