package com.example.notificationscheduler.service.digest;

import com.example.notificationscheduler.domain.entity.Event;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders the daily digest text. Pure: counts and the next event are loaded by the caller.
 */
public class DigestContentBuilder {

    public static final String TITLE = "Your Daily Digest";
    static final String EMPTY_BODY = "No upcoming plans this week. Time to create some!";

    private static final DateTimeFormatter NEXT_EVENT_FORMAT = DateTimeFormatter.ofPattern("EEE h:mm a", Locale.US);

    private final int maxBodyLength;

    public DigestContentBuilder(int maxBodyLength) {
        this.maxBodyLength = maxBodyLength;
    }

    /**
     * @param hostedCount    events the recipient hosts within the look-ahead
     * @param attendingCount events the recipient attends within the look-ahead
     * @param nextEvent      soonest upcoming hosted or attended event, or null
     * @param zone           recipient zone used to format the next event's start
     */
    public DigestContent build(long hostedCount, long attendingCount, Event nextEvent, ZoneId zone) {
        var total = (int) (hostedCount + attendingCount);

        if (total == 0) {
            return new DigestContent(TITLE, EMPTY_BODY, 0, nextEvent != null ? nextEvent.getTitle() : null);
        }

        var body = new StringBuilder("You have ")
                .append(total)
                .append(total > 1 ? " plans" : " plan")
                .append(" this week.");

        if (nextEvent != null) {
            var nextPart = nextPart(nextEvent, zone);
            if (body.length() + nextPart.length() <= maxBodyLength) {
                body.append(nextPart);
            }
        }

        return new DigestContent(TITLE, body.toString(), total, nextEvent != null ? nextEvent.getTitle() : null);
    }

    private String nextPart(Event event, ZoneId zone) {
        var part = new StringBuilder(" Next:");
        if (event.getEmoji() != null && !event.getEmoji().isBlank()) {
            part.append(' ').append(event.getEmoji());
        }
        part.append(' ').append(event.getTitle())
                .append(' ').append(NEXT_EVENT_FORMAT.format(event.getStartTime().atZone(zone)));
        return part.toString();
    }
}
