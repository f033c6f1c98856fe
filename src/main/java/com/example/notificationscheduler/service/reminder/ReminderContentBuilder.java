package com.example.notificationscheduler.service.reminder;

import com.example.notificationscheduler.domain.entity.Event;
import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.enums.NotificationType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds reminder notification content. No I/O.
 */
@Component
public class ReminderContentBuilder {

    public static String offsetLabel(int offsetMinutes) {
        if (offsetMinutes >= 1440) {
            var days = offsetMinutes / 1440;
            return days == 1 ? "Tomorrow" : "In " + days + " days";
        }
        if (offsetMinutes >= 60) {
            var hours = offsetMinutes / 60;
            return hours == 1 ? "In 1 hour" : "In " + hours + " hours";
        }
        return "In " + offsetMinutes + " minutes";
    }

    public Notification buildNotification(Event event, String recipientId, int offsetMinutes) {
        var data = new HashMap<String, Object>();
        data.put("eventId", event.getId());
        data.put("eventTitle", event.getTitle());
        data.put("eventEmoji", event.getEmoji());
        data.put("offsetMinutes", offsetMinutes);
        data.put("deepLink", deepLink(event));

        return Notification.builder()
                .userId(recipientId)
                .type(NotificationType.EVENT_REMINDER)
                .title("Reminder: " + event.getTitle())
                .body(offsetLabel(offsetMinutes) + ". Tap to view")
                .data(data)
                .build();
    }

    public Map<String, Object> buildPushData(Event event) {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", NotificationType.EVENT_REMINDER.name());
        data.put("eventId", event.getId());
        data.put("screen", "event");
        data.put("deepLink", deepLink(event));
        return data;
    }

    private String deepLink(Event event) {
        return "/event/" + event.getId();
    }
}
