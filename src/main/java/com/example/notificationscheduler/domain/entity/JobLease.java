package com.example.notificationscheduler.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;

/**
 * One row per job name, used as a distributed mutex with a TTL.
 * <p>
 * Rows are written only through the conditional upsert in
 * {@code JobLeaseRepositoryCustomImpl}; this mapping is used for reads,
 * owner-scoped release and extension.
 */
@Entity
@Table(name = "job_lease")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobLease {

    @Id
    @Column(name = "job_name", nullable = false, length = 100)
    private String jobName;

    /**
     * Opaque identifier of the run holding the lease
     */
    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    /**
     * Absolute expiry of the lease
     */
    @Column(name = "locked_until", nullable = false)
    private Instant lockedUntil;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    public boolean isExpired(Instant now) {
        return lockedUntil.isBefore(now);
    }

    public Duration remaining(Instant now) {
        var remaining = Duration.between(now, lockedUntil);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
