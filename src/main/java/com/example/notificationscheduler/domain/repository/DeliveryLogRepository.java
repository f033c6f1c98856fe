package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.DeliveryLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface DeliveryLogRepository extends JpaRepository<DeliveryLogEntry, UUID> {

    boolean existsByUserIdAndDedupeKey(String userId, String dedupeKey);

    @Transactional
    @Modifying
    @Query("DELETE FROM DeliveryLogEntry d WHERE d.sentAt < :cutoff")
    int deleteSentBefore(@Param("cutoff") Instant cutoff);
}
