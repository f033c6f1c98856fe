package com.example.notificationscheduler.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "event", indexes = {
        @Index(name = "idx_event_start_time", columnList = "start_time"),
        @Index(name = "idx_event_host", columnList = "host_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Event {

    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "host_id", nullable = false, length = 100)
    private String hostId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "emoji", length = 32)
    private String emoji;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;
}
