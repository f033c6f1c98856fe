package com.example.notificationscheduler.service.reminder;

import com.example.notificationscheduler.domain.entity.Event;
import com.example.notificationscheduler.domain.enums.NotificationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReminderContentBuilder Tests")
class ReminderContentBuilderTest {

    private final ReminderContentBuilder builder = new ReminderContentBuilder();

    private final Event event = Event.builder()
            .id("evt-1")
            .hostId("host-1")
            .title("Sunset hike")
            .emoji("🥾")
            .startTime(Instant.parse("2025-06-04T18:00:00Z"))
            .build();

    @ParameterizedTest(name = "{0} minutes -> {1}")
    @CsvSource({
            "30, In 30 minutes",
            "60, In 1 hour",
            "120, In 2 hours",
            "1440, Tomorrow",
            "2880, In 2 days"
    })
    @DisplayName("Should label offsets")
    void shouldLabelOffsets(int offsetMinutes, String expected) {
        assertThat(ReminderContentBuilder.offsetLabel(offsetMinutes)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should build the in-app notification")
    void shouldBuildNotification() {
        var notification = builder.buildNotification(event, "user-2", 30);

        assertThat(notification.getUserId()).isEqualTo("user-2");
        assertThat(notification.getType()).isEqualTo(NotificationType.EVENT_REMINDER);
        assertThat(notification.getTitle()).isEqualTo("Reminder: Sunset hike");
        assertThat(notification.getBody()).isEqualTo("In 30 minutes. Tap to view");
        assertThat(notification.getData())
                .containsEntry("eventId", "evt-1")
                .containsEntry("offsetMinutes", 30)
                .containsEntry("deepLink", "/event/evt-1");
        assertThat(notification.isRead()).isFalse();
    }

    @Test
    @DisplayName("Should build the push payload")
    void shouldBuildPushData() {
        assertThat(builder.buildPushData(event))
                .containsEntry("type", "EVENT_REMINDER")
                .containsEntry("eventId", "evt-1")
                .containsEntry("screen", "event");
    }
}
