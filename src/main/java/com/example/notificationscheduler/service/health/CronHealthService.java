package com.example.notificationscheduler.service.health;

import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.dto.CronJobResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Backs GET /api/cron/health: confirms the secret works and the database answers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CronHealthService {

    private final JdbcTemplate jdbcTemplate;
    private final NotificationSchedulerProperties properties;
    private final Environment environment;
    private final Clock clock;

    public CronJobResponse check() {
        var startedAt = clock.instant();
        log.info("[Cron] health: CHECK");

        var dbStatus = "ok";
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.warn("[Cron] health: database check failed: {}", e.getMessage());
            dbStatus = "error";
        }

        var profiles = environment.getActiveProfiles();
        return CronJobResponse.builder()
                .ok(true)
                .job("health")
                .ts(clock.instant())
                .durationMs(Duration.between(startedAt, clock.instant()).toMillis())
                .buildId(properties.getShortBuildId())
                .message("Cron system healthy")
                .db(dbStatus)
                .env(profiles.length > 0 ? String.join(",", profiles) : "default")
                .build();
    }
}
