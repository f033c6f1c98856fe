package com.example.notificationscheduler.service.delivery;

import com.example.notificationscheduler.domain.entity.Notification;

import java.util.Map;

/**
 * One notification occasion for one recipient: the in-app row to record and the push to send.
 */
public record Occasion(
        String recipientId,
        String dedupeKey,
        Notification notification,
        Map<String, Object> pushData,
        String channel
) {
}
