package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.converter.PushPermissionStatusConverter;
import com.example.notificationscheduler.domain.enums.PushPermissionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Application user, owned by the surrounding application. Read-only here.
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

    @Id
    @Column(name = "id", nullable = false, length = 100)
    private String id;

    @Column(name = "name")
    private String name;

    @Convert(converter = PushPermissionStatusConverter.class)
    @Column(name = "push_permission_status", nullable = false, length = 20)
    @Builder.Default
    private PushPermissionStatus pushPermissionStatus = PushPermissionStatus.UNDETERMINED;
}
