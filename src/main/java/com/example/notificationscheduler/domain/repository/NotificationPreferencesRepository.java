package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationPreferencesRepository extends JpaRepository<NotificationPreferences, UUID> {

    Optional<NotificationPreferences> findByUserId(String userId);

    List<NotificationPreferences> findByDailyDigestTrue();
}
