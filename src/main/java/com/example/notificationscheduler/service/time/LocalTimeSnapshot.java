package com.example.notificationscheduler.service.time;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

/**
 * A recipient's wall-clock reading at one instant.
 *
 * @param hour                 0..23
 * @param minute               0..59
 * @param minutesSinceMidnight hour * 60 + minute
 * @param dayOfWeek            MON..SUN
 * @param localDate            yyyy-MM-dd in the recipient's zone
 * @param zone                 zone actually used, UTC after a fallback
 */
public record LocalTimeSnapshot(
        int hour,
        int minute,
        int minutesSinceMidnight,
        String dayOfWeek,
        String localDate,
        ZoneId zone
) {

    static LocalTimeSnapshot of(ZonedDateTime local) {
        return new LocalTimeSnapshot(
                local.getHour(),
                local.getMinute(),
                local.getHour() * 60 + local.getMinute(),
                local.getDayOfWeek().name().substring(0, 3).toUpperCase(Locale.ROOT),
                local.toLocalDate().toString(),
                local.getZone()
        );
    }
}
