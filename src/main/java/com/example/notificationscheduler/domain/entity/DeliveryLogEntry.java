package com.example.notificationscheduler.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Idempotency ledger entry: one row per handled notification occasion.
 * <p>
 * The unique (user_id, dedupe_key) constraint is the commit point of
 * "this occasion has been handled". Rows are never updated.
 */
@Entity
@Table(name = "delivery_log",
        uniqueConstraints = @UniqueConstraint(name = "uq_delivery_log_user_key", columnNames = {"user_id", "dedupe_key"}),
        indexes = @Index(name = "idx_delivery_log_sent_at", columnList = "sent_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 100)
    private String userId;

    /**
     * Deterministic occasion key, e.g. reminder:&lt;eventId&gt;:&lt;userId&gt;:30
     */
    @Column(name = "dedupe_key", nullable = false, updatable = false, length = 255)
    private String dedupeKey;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private Instant sentAt;

    @PrePersist
    protected void onCreate() {
        if (sentAt == null) {
            sentAt = Instant.now();
        }
    }
}
