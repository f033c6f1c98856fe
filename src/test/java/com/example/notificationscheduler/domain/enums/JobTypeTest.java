package com.example.notificationscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobType Tests")
class JobTypeTest {

    @Test
    @DisplayName("Should resolve every job by its name")
    void shouldResolveByJobName() {
        for (var type : JobType.values()) {
            assertThat(JobType.fromJobName(type.getJobName())).isEqualTo(type);
        }
    }

    @Test
    @DisplayName("Should reject unknown job names")
    void shouldRejectUnknownJobName() {
        assertThatThrownBy(() -> JobType.fromJobName("weekly_summary"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("weekly_summary");
    }

    @Test
    @DisplayName("Only reminders and digest run under a lease")
    void shouldRequireLeaseForDeliveryJobsOnly() {
        assertThat(JobType.REMINDERS.isLeaseRequired()).isTrue();
        assertThat(JobType.DIGEST.isLeaseRequired()).isTrue();
        assertThat(JobType.TOKEN_CLEANUP.isLeaseRequired()).isFalse();
        assertThat(JobType.DEDUPE_CLEANUP.isLeaseRequired()).isFalse();
        assertThat(JobType.SESSION_CLEANUP.isLeaseRequired()).isFalse();
    }

    @Test
    @DisplayName("Should carry default TTLs and stable failure codes")
    void shouldCarryDefaults() {
        assertThat(JobType.REMINDERS.getDefaultLeaseTtl()).isEqualTo(Duration.ofMinutes(3));
        assertThat(JobType.DIGEST.getDefaultLeaseTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(JobType.TOKEN_CLEANUP.getDefaultLeaseTtl()).isEqualTo(Duration.ofMinutes(2));
        assertThat(JobType.REMINDERS.getFailureCode()).isEqualTo("REMINDERS_RUN_FAILED");
        assertThat(JobType.DEDUPE_CLEANUP.getFailureCode()).isEqualTo("DEDUPE_CLEANUP_FAILED");
        assertThat(JobType.SESSION_CLEANUP.getFailureCode()).isEqualTo("SESSION_CLEANUP_FAILED");
    }
}
