package com.example.notificationscheduler.service.reminder;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.entity.AppUser;
import com.example.notificationscheduler.domain.entity.Event;
import com.example.notificationscheduler.domain.entity.EventJoinRequest;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.domain.enums.PushPermissionStatus;
import com.example.notificationscheduler.domain.repository.AppUserRepository;
import com.example.notificationscheduler.domain.repository.EventJoinRequestRepository;
import com.example.notificationscheduler.domain.repository.EventRepository;
import com.example.notificationscheduler.dto.ReminderRunMetrics;
import com.example.notificationscheduler.service.dedup.DeliveryDedupStore;
import com.example.notificationscheduler.service.delivery.DispatchOutcome;
import com.example.notificationscheduler.service.delivery.Occasion;
import com.example.notificationscheduler.service.delivery.OccasionDispatcher;
import com.example.notificationscheduler.service.job.CronJob;
import com.example.notificationscheduler.service.job.JobContext;
import com.example.notificationscheduler.service.preferences.NotificationPreferencesService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sends event reminders to hosts and accepted attendees as events enter each offset window.
 * <p>
 * Each offset window is one trigger cadence wide and centred on now + offset, so consecutive
 * runs tile the timeline. A missed or repeated run is covered by the delivery ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderScheduler implements CronJob {

    private final EventRepository eventRepository;
    private final EventJoinRequestRepository joinRequestRepository;
    private final AppUserRepository appUserRepository;
    private final NotificationPreferencesService preferencesService;
    private final DeliveryDedupStore dedupStore;
    private final OccasionDispatcher dispatcher;
    private final ReminderContentBuilder contentBuilder;
    private final NotificationSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Override
    public JobType getJobType() {
        return JobType.REMINDERS;
    }

    @Override
    public ReminderRunMetrics run(JobContext context) {
        var metrics = new ReminderRunMetrics();
        var now = clock.instant();
        var halfCadence = properties.getTriggerCadence().dividedBy(2);

        for (var offsetMinutes : properties.getReminders().getOffsetsMinutes()) {
            var target = now.plus(Duration.ofMinutes(offsetMinutes));
            var events = eventRepository.findStartingBetween(target.minus(halfCadence), target.plus(halfCadence));
            log.debug("[Reminders] offset={}m: {} event(s) in window", offsetMinutes, events.size());

            for (var event : events) {
                var recipients = resolveRecipients(event);
                var users = appUserRepository.findAllById(recipients).stream()
                        .collect(Collectors.toMap(AppUser::getId, Function.identity()));

                for (var recipientId : recipients) {
                    processRecipient(event, recipientId, users.get(recipientId), offsetMinutes, metrics);
                }
            }

            // heartbeat between windows
            context.extendLease();
        }

        return metrics;
    }

    /**
     * Host first, then accepted attendees, each recipient once.
     */
    List<String> resolveRecipients(Event event) {
        var recipients = new LinkedHashSet<String>();
        recipients.add(event.getHostId());
        joinRequestRepository.findByEventIdAndStatus(event.getId(), JoinRequestStatus.ACCEPTED).stream()
                .map(EventJoinRequest::getUserId)
                .forEach(recipients::add);
        return new ArrayList<>(recipients);
    }

    private void processRecipient(Event event, String recipientId, AppUser user, int offsetMinutes,
                                  ReminderRunMetrics metrics) {
        metrics.setProcessed(metrics.getProcessed() + 1);

        var dedupeKey = DeliveryDedupStore.reminderKey(event.getId(), recipientId, offsetMinutes);
        if (dedupStore.isRecorded(recipientId, dedupeKey)) {
            skipDedupe(metrics);
            return;
        }

        var prefs = preferencesService.getOrCreate(recipientId);
        if (!prefs.wantsReminderAt(offsetMinutes)) {
            log.debug("[Reminders] {} skipped by preferences", dedupeKey);
            metrics.getSkipped().setPrefs(metrics.getSkipped().getPrefs() + 1);
            metricsConfig.recordSkip(JobType.REMINDERS, "prefs");
            return;
        }

        if (user == null) {
            log.warn("[Reminders] user {} not found, recording in-app only", recipientId);
        }
        var permission = user != null ? user.getPushPermissionStatus() : PushPermissionStatus.UNDETERMINED;

        var occasion = new Occasion(
                recipientId,
                dedupeKey,
                contentBuilder.buildNotification(event, recipientId, offsetMinutes),
                contentBuilder.buildPushData(event),
                NotificationType.EVENT_REMINDER.getChannelId());

        record(dispatcher.dispatch(occasion, prefs, permission), metrics);
    }

    private void record(DispatchOutcome outcome, ReminderRunMetrics metrics) {
        if (outcome == DispatchOutcome.ALREADY_HANDLED) {
            skipDedupe(metrics);
            return;
        }

        var sent = metrics.getSent();
        var skipped = metrics.getSkipped();
        sent.setInApp(sent.getInApp() + 1);
        metricsConfig.recordDelivery(JobType.REMINDERS, "in_app");

        switch (outcome) {
            case QUIET_HOURS -> {
                skipped.setQuietHours(skipped.getQuietHours() + 1);
                metricsConfig.recordSkip(JobType.REMINDERS, "quiet_hours");
            }
            case NO_TOKEN -> {
                skipped.setNoToken(skipped.getNoToken() + 1);
                metricsConfig.recordSkip(JobType.REMINDERS, "no_token");
            }
            case PUSH_SENT -> {
                sent.setPush(sent.getPush() + 1);
                metricsConfig.recordDelivery(JobType.REMINDERS, "push");
            }
            default -> {
                // in-app only or push failed: nothing more to count
            }
        }
    }

    private void skipDedupe(ReminderRunMetrics metrics) {
        metrics.getSkipped().setDedupe(metrics.getSkipped().getDedupe() + 1);
        metricsConfig.recordSkip(JobType.REMINDERS, "dedupe");
    }
}
