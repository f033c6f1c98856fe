package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.PushToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for device push tokens.
 */
@Repository
public interface PushTokenRepository extends JpaRepository<PushToken, UUID> {

    List<PushToken> findByUserIdAndActiveTrue(String userId);

    /**
     * Deactivate a single token reported gone by the push vendor.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE PushToken t
            SET t.active = false,
                t.updatedAt = :now
            WHERE t.token = :token
              AND t.active = true
            """)
    int deactivateByToken(@Param("token") String token, @Param("now") Instant now);

    /**
     * Deactivate active tokens not seen since the cutoff.
     */
    @Transactional
    @Modifying
    @Query("""
            UPDATE PushToken t
            SET t.active = false,
                t.updatedAt = :now
            WHERE t.active = true
              AND t.lastSeenAt < :cutoff
            """)
    int deactivateUnseenSince(@Param("cutoff") Instant cutoff, @Param("now") Instant now);

    /**
     * Hard-delete inactive tokens not seen since the cutoff.
     */
    @Transactional
    @Modifying
    @Query("DELETE FROM PushToken t WHERE t.active = false AND t.lastSeenAt < :cutoff")
    int deleteInactiveUnseenSince(@Param("cutoff") Instant cutoff);
}
