package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByUserIdAndTypeOrderByCreatedAtDesc(String userId, NotificationType type);
}
