package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.converter.JoinRequestStatusConverter;
import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Table(name = "event_join_request", indexes = {
        @Index(name = "idx_join_request_event_status", columnList = "event_id, status"),
        @Index(name = "idx_join_request_user_status", columnList = "user_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EventJoinRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, length = 100)
    private String eventId;

    @Column(name = "user_id", nullable = false, length = 100)
    private String userId;

    @Convert(converter = JoinRequestStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private JoinRequestStatus status;
}
