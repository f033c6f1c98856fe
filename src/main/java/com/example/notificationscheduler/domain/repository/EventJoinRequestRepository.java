package com.example.notificationscheduler.domain.repository;

import com.example.notificationscheduler.domain.entity.EventJoinRequest;
import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EventJoinRequestRepository extends JpaRepository<EventJoinRequest, UUID> {

    List<EventJoinRequest> findByEventIdAndStatus(String eventId, JoinRequestStatus status);
}
