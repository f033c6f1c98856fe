package com.example.notificationscheduler.service.time;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Resolves a recipient's local time and quiet hours from their IANA timezone.
 * <p>
 * Never throws: an unknown zone resolves as UTC.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalTimeResolver {

    private final Clock clock;
    private final MetricsConfig metricsConfig;

    public LocalTimeSnapshot localNow(String timezone) {
        return localAt(clock.instant(), timezone);
    }

    public LocalTimeSnapshot localAt(Instant instant, String timezone) {
        return LocalTimeSnapshot.of(instant.atZone(resolveZone(timezone)));
    }

    /**
     * Zone for the given id, UTC when blank or unknown.
     */
    public ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("[LocalTime] Invalid timezone \"{}\", falling back to UTC", timezone);
            metricsConfig.recordTimezoneFallback();
            return ZoneOffset.UTC;
        }
    }

    /**
     * Whether the current local time falls in the recipient's quiet hours.
     * Start after end means the window wraps midnight.
     */
    public boolean isQuietHours(NotificationPreferences prefs, String timezone) {
        if (prefs == null || !prefs.isQuietHoursEnabled()) {
            return false;
        }

        var now = localNow(timezone).minutesSinceMidnight();
        var start = minutesOrDefault(prefs.getQuietHoursStart(), NotificationPreferences.DEFAULT_QUIET_HOURS_START);
        var end = minutesOrDefault(prefs.getQuietHoursEnd(), NotificationPreferences.DEFAULT_QUIET_HOURS_END);

        if (start > end) {
            return now >= start || now < end;
        }
        return now >= start && now < end;
    }

    public boolean isQuietHours(NotificationPreferences prefs) {
        return prefs != null && isQuietHours(prefs, prefs.getTimezone());
    }

    /**
     * Distance between two minute-of-day values on the 24h circle, so 23:55 and 00:05 are 10 apart.
     */
    public static int circularDistanceMinutes(int a, int b) {
        var diff = Math.abs(a - b) % 1440;
        return Math.min(diff, 1440 - diff);
    }

    private int minutesOrDefault(String value, String fallback) {
        var minutes = NotificationPreferences.parseTimeOfDay(value);
        return minutes >= 0 ? minutes : NotificationPreferences.parseTimeOfDay(fallback);
    }
}
