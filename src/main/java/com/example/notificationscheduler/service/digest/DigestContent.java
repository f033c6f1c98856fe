package com.example.notificationscheduler.service.digest;

/**
 * Rendered digest text plus the values echoed in the notification payload.
 */
public record DigestContent(String title, String body, int totalEvents, String nextEventTitle) {
}
