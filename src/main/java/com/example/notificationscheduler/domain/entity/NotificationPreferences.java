package com.example.notificationscheduler.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-user notification preferences.
 * <p>
 * List-valued settings are stored as comma-separated text; the parsing
 * helpers below fall back to the defaults when a column is blank or
 * unparseable, so a damaged row never blocks a job.
 */
@Entity
@Table(name = "notification_preferences")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationPreferences {

    public static final List<Integer> DEFAULT_REMINDER_OFFSETS = List.of(30, 120, 1440);
    public static final String DEFAULT_DIGEST_DAYS = "MON,TUE,WED,THU,FRI";
    public static final String DEFAULT_DIGEST_TIME = "09:00";
    public static final String DEFAULT_QUIET_HOURS_START = "22:00";
    public static final String DEFAULT_QUIET_HOURS_END = "08:00";
    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true, length = 100)
    private String userId;

    @Column(name = "push_enabled", nullable = false)
    @Builder.Default
    private boolean pushEnabled = true;

    @Column(name = "event_reminders", nullable = false)
    @Builder.Default
    private boolean eventReminders = true;

    @Column(name = "daily_digest", nullable = false)
    @Builder.Default
    private boolean dailyDigest = false;

    /**
     * Local delivery time of the digest, HH:MM
     */
    @Column(name = "daily_digest_time", nullable = false, length = 5)
    @Builder.Default
    private String dailyDigestTime = DEFAULT_DIGEST_TIME;

    @Column(name = "digest_days_of_week", nullable = false, length = 64)
    @Builder.Default
    private String digestDaysOfWeek = DEFAULT_DIGEST_DAYS;

    @Column(name = "quiet_hours_enabled", nullable = false)
    @Builder.Default
    private boolean quietHoursEnabled = false;

    @Column(name = "quiet_hours_start", nullable = false, length = 5)
    @Builder.Default
    private String quietHoursStart = DEFAULT_QUIET_HOURS_START;

    @Column(name = "quiet_hours_end", nullable = false, length = 5)
    @Builder.Default
    private String quietHoursEnd = DEFAULT_QUIET_HOURS_END;

    /**
     * IANA zone id. Invalid values are tolerated and resolved as UTC.
     */
    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = DEFAULT_TIMEZONE;

    /**
     * Minutes before event start, comma-separated
     */
    @Column(name = "reminder_offsets", nullable = false, length = 128)
    @Builder.Default
    private String reminderOffsets = "30,120,1440";

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Defaults used when a user has never saved preferences.
     */
    public static NotificationPreferences defaultsFor(String userId) {
        return NotificationPreferences.builder()
                .userId(userId)
                .build();
    }

    public List<Integer> getReminderOffsetMinutes() {
        if (reminderOffsets == null || reminderOffsets.isBlank()) {
            return DEFAULT_REMINDER_OFFSETS;
        }
        var offsets = new ArrayList<Integer>();
        for (var part : reminderOffsets.split(",")) {
            try {
                var value = Integer.parseInt(part.trim());
                if (value > 0) {
                    offsets.add(value);
                }
            } catch (NumberFormatException ignored) {
                // unparseable entries are dropped
            }
        }
        return offsets.isEmpty() ? DEFAULT_REMINDER_OFFSETS : List.copyOf(offsets);
    }

    public boolean wantsReminderAt(int offsetMinutes) {
        return eventReminders && getReminderOffsetMinutes().contains(offsetMinutes);
    }

    /**
     * Upper-cased three-letter day abbreviations (MON..SUN).
     */
    public Set<String> getDigestDays() {
        var raw = digestDaysOfWeek == null || digestDaysOfWeek.isBlank() ? DEFAULT_DIGEST_DAYS : digestDaysOfWeek;
        var days = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(day -> !day.isEmpty())
                .map(day -> day.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        return days.isEmpty() ? Set.of(DEFAULT_DIGEST_DAYS.split(",")) : days;
    }

    public int getDigestTimeMinutes() {
        var parsed = parseTimeOfDay(dailyDigestTime);
        return parsed >= 0 ? parsed : parseTimeOfDay(DEFAULT_DIGEST_TIME);
    }

    /**
     * Parses HH:MM into minutes since midnight, or -1 when the value is not a valid time.
     */
    public static int parseTimeOfDay(String value) {
        if (value == null) {
            return -1;
        }
        var parts = value.trim().split(":");
        if (parts.length != 2) {
            return -1;
        }
        try {
            var hour = Integer.parseInt(parts[0]);
            var minute = Integer.parseInt(parts[1]);
            if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
                return -1;
            }
            return hour * 60 + minute;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
