package com.example.notificationscheduler.domain.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * PostgreSQL upsert for lease acquisition.
 * <p>
 * The conflict branch only fires when the stored lease has expired, so a returned row
 * means this caller wrote it. Concurrent callers are serialized by the primary key.
 */
@RequiredArgsConstructor
public class JobLeaseRepositoryCustomImpl implements JobLeaseRepositoryCustom {

    private static final String ACQUIRE_SQL = """
            INSERT INTO job_lease (job_name, owner_id, locked_until, acquired_at)
            VALUES (:jobName, :ownerId, :lockedUntil, :now)
            ON CONFLICT (job_name) DO UPDATE
            SET owner_id = EXCLUDED.owner_id,
                locked_until = EXCLUDED.locked_until,
                acquired_at = EXCLUDED.acquired_at
            WHERE job_lease.locked_until < EXCLUDED.acquired_at
            RETURNING owner_id
            """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public Optional<String> tryAcquire(String jobName, String ownerId, Instant now, Instant lockedUntil) {
        var params = new MapSqlParameterSource()
                .addValue("jobName", jobName)
                .addValue("ownerId", ownerId)
                .addValue("lockedUntil", Timestamp.from(lockedUntil))
                .addValue("now", Timestamp.from(now));

        var owners = jdbcTemplate.queryForList(ACQUIRE_SQL, params, String.class);
        return owners.stream().findFirst();
    }
}
