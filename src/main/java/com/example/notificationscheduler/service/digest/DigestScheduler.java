package com.example.notificationscheduler.service.digest;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.domain.entity.Notification;
import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.domain.enums.JoinRequestStatus;
import com.example.notificationscheduler.domain.enums.NotificationType;
import com.example.notificationscheduler.domain.repository.AppUserRepository;
import com.example.notificationscheduler.domain.repository.EventRepository;
import com.example.notificationscheduler.dto.DigestRunMetrics;
import com.example.notificationscheduler.service.dedup.DeliveryDedupStore;
import com.example.notificationscheduler.service.delivery.DispatchOutcome;
import com.example.notificationscheduler.service.delivery.Occasion;
import com.example.notificationscheduler.service.delivery.OccasionDispatcher;
import com.example.notificationscheduler.service.job.CronJob;
import com.example.notificationscheduler.service.job.JobContext;
import com.example.notificationscheduler.service.preferences.NotificationPreferencesService;
import com.example.notificationscheduler.service.time.LocalTimeResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends each subscribed recipient one digest per local day, near their chosen local time.
 * <p>
 * The dedupe key uses the recipient's local date, so a digest near midnight UTC still
 * lands once per local day.
 */
@Slf4j
@Service
public class DigestScheduler implements CronJob {

    private final NotificationPreferencesService preferencesService;
    private final AppUserRepository appUserRepository;
    private final EventRepository eventRepository;
    private final DeliveryDedupStore dedupStore;
    private final OccasionDispatcher dispatcher;
    private final LocalTimeResolver localTimeResolver;
    private final NotificationSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final DigestContentBuilder contentBuilder;

    public DigestScheduler(NotificationPreferencesService preferencesService,
                           AppUserRepository appUserRepository,
                           EventRepository eventRepository,
                           DeliveryDedupStore dedupStore,
                           OccasionDispatcher dispatcher,
                           LocalTimeResolver localTimeResolver,
                           NotificationSchedulerProperties properties,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.preferencesService = preferencesService;
        this.appUserRepository = appUserRepository;
        this.eventRepository = eventRepository;
        this.dedupStore = dedupStore;
        this.dispatcher = dispatcher;
        this.localTimeResolver = localTimeResolver;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        this.contentBuilder = new DigestContentBuilder(properties.getDigest().getMaxBodyLength());
    }

    @Override
    public JobType getJobType() {
        return JobType.DIGEST;
    }

    @Override
    public DigestRunMetrics run(JobContext context) {
        var metrics = new DigestRunMetrics();
        var subscribers = preferencesService.findDigestSubscribers();
        metrics.setEligibleUsers(subscribers.size());

        var extendEvery = properties.getDigest().getLeaseExtendEvery();
        var handled = 0;
        for (var prefs : subscribers) {
            processRecipient(prefs, metrics);
            if (++handled % extendEvery == 0) {
                context.extendLease();
            }
        }

        return metrics;
    }

    private void processRecipient(NotificationPreferences prefs, DigestRunMetrics metrics) {
        var userId = prefs.getUserId();
        var now = clock.instant();
        var local = localTimeResolver.localAt(now, prefs.getTimezone());

        if (!prefs.getDigestDays().contains(local.dayOfWeek())) {
            metrics.getSkipped().setDay(metrics.getSkipped().getDay() + 1);
            metricsConfig.recordSkip(JobType.DIGEST, "day");
            return;
        }

        var distance = LocalTimeResolver.circularDistanceMinutes(local.minutesSinceMidnight(), prefs.getDigestTimeMinutes());
        if (distance > properties.getDigest().getToleranceMinutes()) {
            metrics.getSkipped().setWindow(metrics.getSkipped().getWindow() + 1);
            metricsConfig.recordSkip(JobType.DIGEST, "window");
            return;
        }

        var dedupeKey = DeliveryDedupStore.digestKey(userId, local.localDate());
        if (dedupStore.isRecorded(userId, dedupeKey)) {
            skipDedupe(metrics);
            return;
        }

        var user = appUserRepository.findById(userId);
        if (user.isEmpty()) {
            log.warn("[Digest] user {} has digest preferences but no user row, ignoring", userId);
            return;
        }

        var content = buildContent(userId, now, local.zone());
        var occasion = new Occasion(userId, dedupeKey, toNotification(userId, content), pushData(),
                NotificationType.DAILY_DIGEST.getChannelId());

        record(dispatcher.dispatch(occasion, prefs, user.get().getPushPermissionStatus()), metrics);
    }

    private DigestContent buildContent(String userId, Instant now, ZoneId zone) {
        var until = now.plus(Duration.ofDays(properties.getDigest().getLookaheadDays()));
        var hosted = eventRepository.countHostedBetween(userId, now, until);
        var attending = eventRepository.countAttendingBetween(userId, now, until, JoinRequestStatus.ACCEPTED);
        var next = eventRepository.findUpcomingForUser(userId, now, JoinRequestStatus.ACCEPTED, PageRequest.of(0, 1)).stream()
                .findFirst()
                .orElse(null);
        return contentBuilder.build(hosted, attending, next, zone);
    }

    private Notification toNotification(String userId, DigestContent content) {
        var data = new HashMap<String, Object>();
        data.put("totalEvents", content.totalEvents());
        if (content.nextEventTitle() != null) {
            data.put("nextEventTitle", content.nextEventTitle());
        }
        data.put("deepLink", "/");

        return Notification.builder()
                .userId(userId)
                .type(NotificationType.DAILY_DIGEST)
                .title(content.title())
                .body(content.body())
                .data(data)
                .build();
    }

    private Map<String, Object> pushData() {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", NotificationType.DAILY_DIGEST.name());
        data.put("screen", "home");
        data.put("deepLink", "/");
        return data;
    }

    private void record(DispatchOutcome outcome, DigestRunMetrics metrics) {
        if (outcome == DispatchOutcome.ALREADY_HANDLED) {
            skipDedupe(metrics);
            return;
        }

        var sent = metrics.getSent();
        var skipped = metrics.getSkipped();
        sent.setInApp(sent.getInApp() + 1);
        metricsConfig.recordDelivery(JobType.DIGEST, "in_app");

        switch (outcome) {
            case QUIET_HOURS -> {
                skipped.setQuietHours(skipped.getQuietHours() + 1);
                metricsConfig.recordSkip(JobType.DIGEST, "quiet_hours");
            }
            case NO_TOKEN -> {
                skipped.setNoToken(skipped.getNoToken() + 1);
                metricsConfig.recordSkip(JobType.DIGEST, "no_token");
            }
            case PUSH_SENT -> {
                sent.setPush(sent.getPush() + 1);
                metricsConfig.recordDelivery(JobType.DIGEST, "push");
            }
            default -> {
                // in-app only or push failed
            }
        }
    }

    private void skipDedupe(DigestRunMetrics metrics) {
        metrics.getSkipped().setDedupe(metrics.getSkipped().getDedupe() + 1);
        metricsConfig.recordSkip(JobType.DIGEST, "dedupe");
    }
}
