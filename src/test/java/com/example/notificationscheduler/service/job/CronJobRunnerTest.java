package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.ReminderRunMetrics;
import com.example.notificationscheduler.dto.SkippedRunMetrics;
import com.example.notificationscheduler.dto.TokenCleanupMetrics;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.lease.JobLeaseManager;
import com.example.notificationscheduler.service.lease.LeaseAcquisition;
import com.example.notificationscheduler.service.lease.LeaseStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CronJobRunner Tests")
class CronJobRunnerTest {

    private static final Instant NOW = Instant.parse("2025-06-04T12:00:00Z");

    @Mock
    private CronJobRegistry jobRegistry;

    @Mock
    private JobLeaseManager leaseManager;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private CronJob job;

    private NotificationSchedulerProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private CronJobRunner runner;

    @BeforeEach
    void setUp() {
        properties = new NotificationSchedulerProperties();
        properties.setBuildId("3f9a2c17be0d4e");
        meterRegistry = new SimpleMeterRegistry();
        runner = new CronJobRunner(jobRegistry, leaseManager, properties, new MetricsConfig(meterRegistry),
                slackAlertService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static LeaseAcquisition held(String jobName) {
        return LeaseAcquisition.acquired(jobName, "owner-1", NOW.plus(Duration.ofMinutes(3)));
    }

    @Nested
    @DisplayName("Lease-guarded Jobs")
    class LeaseGuardedTests {

        @BeforeEach
        void setUp() {
            when(jobRegistry.getJobOrThrow(JobType.REMINDERS)).thenReturn(job);
        }

        @Test
        @DisplayName("Should run under a held lease and release it")
        void shouldRunAndRelease() {
            var lease = held("reminders");
            var metrics = new ReminderRunMetrics();
            metrics.setProcessed(4);
            when(leaseManager.acquire("reminders", Duration.ofMinutes(3))).thenReturn(lease);
            when(job.run(any())).thenReturn(metrics);

            var response = runner.run(JobType.REMINDERS);

            assertThat(response.isOk()).isTrue();
            assertThat(response.getJob()).isEqualTo("reminders");
            assertThat(response.getSkipped()).isNull();
            assertThat(response.getMetrics()).isSameAs(metrics);
            assertThat(response.getBuildId()).isEqualTo("3f9a2c1");
            assertThat(response.getTs()).isEqualTo(NOW);
            verify(leaseManager).release(lease);
        }

        @Test
        @DisplayName("Should hand the lease and its TTL to the job")
        void shouldPassLeaseToJob() {
            properties.getLease().getTtl().put("reminders", Duration.ofMinutes(10));
            var lease = held("reminders");
            when(leaseManager.acquire("reminders", Duration.ofMinutes(10))).thenReturn(lease);
            when(job.run(any())).thenReturn(new ReminderRunMetrics());
            var context = ArgumentCaptor.forClass(JobContext.class);

            runner.run(JobType.REMINDERS);

            verify(job).run(context.capture());
            assertThat(context.getValue().getLease()).isSameAs(lease);
            assertThat(context.getValue().getLeaseTtl()).isEqualTo(Duration.ofMinutes(10));
            assertThat(context.getValue().getStartedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should skip with ok=true when the lease is held elsewhere")
        void shouldSkipWhenLeaseHeld() {
            var notAcquired = LeaseAcquisition.notAcquired("reminders", LeaseStatus.HELD);
            when(leaseManager.acquire(anyString(), any())).thenReturn(notAcquired);

            var response = runner.run(JobType.REMINDERS);

            assertThat(response.isOk()).isTrue();
            assertThat(response.getSkipped()).isTrue();
            assertThat(response.getReason()).isEqualTo("LEASE_HELD");
            assertThat(response.getMetrics()).isSameAs(SkippedRunMetrics.INSTANCE);
            verify(job, never()).run(any());
            verify(leaseManager).release(notAcquired);
        }

        @Test
        @DisplayName("Should skip with LEASE_ERROR when the lease store fails closed")
        void shouldSkipOnLeaseError() {
            when(leaseManager.acquire(anyString(), any()))
                    .thenReturn(LeaseAcquisition.notAcquired("reminders", LeaseStatus.ERROR));

            var response = runner.run(JobType.REMINDERS);

            assertThat(response.getSkipped()).isTrue();
            assertThat(response.getReason()).isEqualTo("LEASE_ERROR");
            verify(job, never()).run(any());
        }

        @Test
        @DisplayName("Should run unguarded when the lease store fails open")
        void shouldRunUnguarded() {
            when(leaseManager.acquire(anyString(), any())).thenReturn(LeaseAcquisition.unguarded("reminders"));
            when(job.run(any())).thenReturn(new ReminderRunMetrics());

            var response = runner.run(JobType.REMINDERS);

            assertThat(response.isOk()).isTrue();
            assertThat(response.getSkipped()).isNull();
        }

        @Test
        @DisplayName("Should report the job error code, alert, and still release the lease")
        void shouldReportFailure() {
            var lease = held("reminders");
            var failure = new IllegalStateException("connection refused");
            when(leaseManager.acquire(anyString(), any())).thenReturn(lease);
            when(job.run(any())).thenThrow(failure);

            var response = runner.run(JobType.REMINDERS);

            assertThat(response.isOk()).isFalse();
            assertThat(response.getError()).isEqualTo("REMINDERS_RUN_FAILED");
            assertThat(response.getMetrics()).isNull();
            verify(slackAlertService).sendJobFailureAlert(JobType.REMINDERS, "REMINDERS_RUN_FAILED", failure);
            verify(leaseManager).release(lease);
            assertThat(meterRegistry.find("notification_scheduler_job_duration")
                    .tag("outcome", "failed").timer()).isNotNull();
        }
    }

    @Test
    @DisplayName("Should run cleanup jobs without a lease")
    void shouldRunUnleasedJob() {
        when(jobRegistry.getJobOrThrow(JobType.TOKEN_CLEANUP)).thenReturn(job);
        when(job.run(any())).thenReturn(TokenCleanupMetrics.builder().deactivated(2).build());

        var response = runner.run(JobType.TOKEN_CLEANUP);

        assertThat(response.isOk()).isTrue();
        assertThat(response.getJob()).isEqualTo("token_cleanup");
        verify(leaseManager, never()).acquire(anyString(), any());
        verify(leaseManager).release(isNull());
    }

    @Test
    @DisplayName("Should fall back to the dev build id")
    void shouldUseDevBuildId() {
        properties.setBuildId("");
        when(jobRegistry.getJobOrThrow(JobType.SESSION_CLEANUP)).thenReturn(job);
        when(job.run(any())).thenReturn(null);

        assertThat(runner.run(JobType.SESSION_CLEANUP).getBuildId()).isEqualTo("dev");
    }

    @Test
    @DisplayName("Should propagate an unregistered job type")
    void shouldRejectUnknownJob() {
        when(jobRegistry.getJobOrThrow(JobType.DIGEST)).thenThrow(new IllegalArgumentException("No cron job registered for: DIGEST"));

        assertThatThrownBy(() -> runner.run(JobType.DIGEST)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(leaseManager, slackAlertService);
    }
}
