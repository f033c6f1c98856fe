package com.example.notificationscheduler.service.delivery;

import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import com.example.notificationscheduler.domain.entity.PushToken;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.domain.enums.PushPermissionStatus;
import com.example.notificationscheduler.domain.repository.PushTokenRepository;
import com.example.notificationscheduler.service.dedup.DeliveryDedupStore;
import com.example.notificationscheduler.service.push.PushDeliveryResult;
import com.example.notificationscheduler.service.push.PushGateway;
import com.example.notificationscheduler.service.push.PushMessage;
import com.example.notificationscheduler.service.time.LocalTimeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("OccasionDispatcher Tests")
class OccasionDispatcherTest {

    @Mock
    private DeliveryDedupStore dedupStore;

    @Mock
    private LocalTimeResolver localTimeResolver;

    @Mock
    private PushTokenRepository pushTokenRepository;

    @Mock
    private PushGateway pushGateway;

    @InjectMocks
    private OccasionDispatcher dispatcher;

    private Occasion occasion;
    private NotificationPreferences prefs;

    @BeforeEach
    void setUp() {
        var notification = Notification.builder()
                .userId("user-1")
                .type(NotificationType.EVENT_REMINDER)
                .title("Reminder: Dinner")
                .body("In 2 hours. Tap to view")
                .build();
        occasion = new Occasion("user-1", "reminder:evt-1:user-1:120", notification,
                Map.of("eventId", "evt-1"), "reminders");
        prefs = NotificationPreferences.defaultsFor("user-1");
    }

    private static PushToken token(String value) {
        return PushToken.builder().userId("user-1").token(value).build();
    }

    @Test
    @DisplayName("Should do nothing further when the occasion is already recorded")
    void shouldStopWhenAlreadyHandled() {
        when(dedupStore.tryRecord(anyString(), anyString(), any())).thenReturn(true);

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.ALREADY_HANDLED);
        assertThat(outcome.isRecorded()).isFalse();
        verifyNoInteractions(pushTokenRepository, pushGateway, localTimeResolver);
    }

    @Test
    @DisplayName("Should record in-app only when push is disabled in preferences")
    void shouldSkipPushWhenDisabled() {
        prefs.setPushEnabled(false);

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.IN_APP_ONLY);
        verify(dedupStore).tryRecord("user-1", "reminder:evt-1:user-1:120", occasion.notification());
        verifyNoInteractions(pushGateway);
    }

    @Test
    @DisplayName("Should record in-app only without OS push permission")
    void shouldSkipPushWithoutPermission() {
        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.DENIED);

        assertThat(outcome).isEqualTo(DispatchOutcome.IN_APP_ONLY);
        verifyNoInteractions(pushGateway);
    }

    @Test
    @DisplayName("Should suppress push during quiet hours but keep the in-app record")
    void shouldSuppressPushInQuietHours() {
        when(localTimeResolver.isQuietHours(prefs)).thenReturn(true);

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.QUIET_HOURS);
        assertThat(outcome.isRecorded()).isTrue();
        verifyNoInteractions(pushGateway);
    }

    @Test
    @DisplayName("Should report quiet hours even when push is disabled")
    void shouldReportQuietHoursWhenPushDisabled() {
        prefs.setPushEnabled(false);
        when(localTimeResolver.isQuietHours(prefs)).thenReturn(true);

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.QUIET_HOURS);
        verifyNoInteractions(pushTokenRepository, pushGateway);
    }

    @Test
    @DisplayName("Should report quiet hours even without OS push permission")
    void shouldReportQuietHoursWithoutPermission() {
        when(localTimeResolver.isQuietHours(prefs)).thenReturn(true);

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.UNDETERMINED);

        assertThat(outcome).isEqualTo(DispatchOutcome.QUIET_HOURS);
        verifyNoInteractions(pushTokenRepository, pushGateway);
    }

    @Test
    @DisplayName("Should report no token when the recipient has no active device")
    void shouldReportNoToken() {
        when(pushTokenRepository.findByUserIdAndActiveTrue("user-1")).thenReturn(List.of());

        assertThat(dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED)).isEqualTo(DispatchOutcome.NO_TOKEN);
        verifyNoInteractions(pushGateway);
    }

    @Test
    @DisplayName("Should push to every active device of the recipient")
    @SuppressWarnings("unchecked")
    void shouldPushToAllDevices() {
        when(pushTokenRepository.findByUserIdAndActiveTrue("user-1"))
                .thenReturn(List.of(token("ExponentPushToken[phone]"), token("ExponentPushToken[tablet]")));
        ArgumentCaptor<List<PushMessage>> captor = ArgumentCaptor.forClass(List.class);
        when(pushGateway.send(captor.capture())).thenReturn(new PushDeliveryResult(2, 0, 2, 0, 0));

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.PUSH_SENT);
        assertThat(captor.getValue()).extracting(PushMessage::to)
                .containsExactly("ExponentPushToken[phone]", "ExponentPushToken[tablet]");
        assertThat(captor.getValue().get(0).title()).isEqualTo("Reminder: Dinner");
        assertThat(captor.getValue().get(0).channel()).isEqualTo("reminders");
    }

    @Test
    @DisplayName("Push failure should not undo the in-app record")
    void shouldKeepRecordOnPushFailure() {
        when(pushTokenRepository.findByUserIdAndActiveTrue("user-1")).thenReturn(List.of(token("ExponentPushToken[phone]")));
        when(pushGateway.send(anyList())).thenReturn(new PushDeliveryResult(1, 0, 0, 1, 0));

        var outcome = dispatcher.dispatch(occasion, prefs, PushPermissionStatus.GRANTED);

        assertThat(outcome).isEqualTo(DispatchOutcome.PUSH_FAILED);
        assertThat(outcome.isRecorded()).isTrue();
    }
}
