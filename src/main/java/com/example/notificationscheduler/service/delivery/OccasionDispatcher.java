package com.example.notificationscheduler.service.delivery;

import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import com.example.notificationscheduler.domain.entity.PushToken;
import com.example.notificationscheduler.domain.enums.PushPermissionStatus;
import com.example.notificationscheduler.domain.repository.PushTokenRepository;
import com.example.notificationscheduler.service.dedup.DeliveryDedupStore;
import com.example.notificationscheduler.service.push.PushGateway;
import com.example.notificationscheduler.service.push.PushMessage;
import com.example.notificationscheduler.service.time.LocalTimeResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Records an occasion once, then pushes it when the recipient allows it.
 * <p>
 * The in-app record is the commit point; push failures never undo it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OccasionDispatcher {

    private final DeliveryDedupStore dedupStore;
    private final LocalTimeResolver localTimeResolver;
    private final PushTokenRepository pushTokenRepository;
    private final PushGateway pushGateway;

    public DispatchOutcome dispatch(Occasion occasion, NotificationPreferences prefs, PushPermissionStatus permission) {
        var recipientId = occasion.recipientId();

        if (dedupStore.tryRecord(recipientId, occasion.dedupeKey(), occasion.notification())) {
            return DispatchOutcome.ALREADY_HANDLED;
        }

        // quiet hours are reported even when push would not have been sent anyway
        if (localTimeResolver.isQuietHours(prefs)) {
            log.debug("[Dispatch] {} push suppressed by quiet hours for {}", occasion.dedupeKey(), recipientId);
            return DispatchOutcome.QUIET_HOURS;
        }

        if (!prefs.isPushEnabled() || permission != PushPermissionStatus.GRANTED) {
            log.debug("[Dispatch] {} in-app only for {} (pushEnabled={}, permission={})",
                    occasion.dedupeKey(), recipientId, prefs.isPushEnabled(), permission);
            return DispatchOutcome.IN_APP_ONLY;
        }

        var tokens = pushTokenRepository.findByUserIdAndActiveTrue(recipientId);
        if (tokens.isEmpty()) {
            log.debug("[Dispatch] {} no active push token for {}", occasion.dedupeKey(), recipientId);
            return DispatchOutcome.NO_TOKEN;
        }

        var notification = occasion.notification();
        var messages = tokens.stream()
                .map(PushToken::getToken)
                .map(token -> new PushMessage(token, notification.getTitle(), notification.getBody(),
                        occasion.pushData(), occasion.channel()))
                .toList();

        var result = pushGateway.send(messages);
        if (result.anySent()) {
            return DispatchOutcome.PUSH_SENT;
        }
        log.warn("[Dispatch] {} push failed for {}: {}", occasion.dedupeKey(), recipientId, result);
        return DispatchOutcome.PUSH_FAILED;
    }
}
