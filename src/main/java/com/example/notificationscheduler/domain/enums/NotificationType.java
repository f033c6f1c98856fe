package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Notification types created by the scheduler jobs.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationType {

    EVENT_REMINDER("reminders"),

    DAILY_DIGEST("default");

    /**
     * Android notification channel used for push
     */
    private final String channelId;
}
