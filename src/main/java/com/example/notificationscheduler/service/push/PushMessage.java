package com.example.notificationscheduler.service.push;

import java.util.Map;

/**
 * A push notification addressed to a single device token.
 */
public record PushMessage(
        String to,
        String title,
        String body,
        Map<String, Object> data,
        String channel
) {
}
