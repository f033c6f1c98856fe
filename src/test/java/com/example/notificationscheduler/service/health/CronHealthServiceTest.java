package com.example.notificationscheduler.service.health;

import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.env.MockEnvironment;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CronHealthService Tests")
class CronHealthServiceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private MockEnvironment environment;
    private CronHealthService healthService;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        var properties = new NotificationSchedulerProperties();
        properties.setBuildId("a1b2c3d4e5f6");
        healthService = new CronHealthService(jdbcTemplate, properties, environment,
                Clock.fixed(Instant.parse("2025-06-04T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should report a reachable database")
    void shouldReportHealthy() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
        environment.setActiveProfiles("prod");

        var response = healthService.check();

        assertThat(response.isOk()).isTrue();
        assertThat(response.getJob()).isEqualTo("health");
        assertThat(response.getDb()).isEqualTo("ok");
        assertThat(response.getEnv()).isEqualTo("prod");
        assertThat(response.getBuildId()).isEqualTo("a1b2c3d");
    }

    @Test
    @DisplayName("Should still answer when the database is down")
    void shouldReportDatabaseError() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        var response = healthService.check();

        assertThat(response.isOk()).isTrue();
        assertThat(response.getDb()).isEqualTo("error");
        assertThat(response.getEnv()).isEqualTo("default");
    }
}
