package com.example.notificationscheduler.service.alert;

import com.example.notificationscheduler.config.SlackProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.lease.LeaseFailurePolicy;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends on-call alerts to Slack when a cron job fails or the lease store is unreachable.
 * <p>
 * All methods run asynchronously and never throw, so alerting can not change a job's outcome.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:notification-scheduler}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Alert for a job run that ended with an unexpected exception.
     */
    @Async
    public void sendJobFailureAlert(JobType jobType, String errorCode, Throwable error) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled. Job {} failed with {} but no alert was sent.", jobType.getJobName(), errorCode);
            return;
        }

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *[" + slackProperties.getEnvironment() + "] Cron job failed: " + jobType.getJobName() + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job")
                                                .value(jobType.getJobName())
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error code")
                                                .value(errorCode)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value("```" + truncate(describe(error), 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "job failure " + jobType.getJobName());
    }

    /**
     * Alert for a lease store error, which either skips the job or lets it run unguarded.
     */
    @Async
    public void sendLeaseErrorAlert(String jobName, LeaseFailurePolicy policy, Throwable error) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Lease error alert not sent for {}", jobName);
            return;
        }

        var consequence = policy == LeaseFailurePolicy.FAIL_OPEN
                ? "Job is running without a lease."
                : "Job run was skipped.";

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":warning:")
                .text(":warning: *[" + slackProperties.getEnvironment() + "] Lease store error for " + jobName + "*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("warning")
                                .text(consequence)
                                .fields(List.of(
                                        Field.builder()
                                                .title("Details")
                                                .value(truncate(describe(error), 500))
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName)
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "lease error " + jobName);
    }

    private void send(Payload payload, String description) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert ({}). Response code: {}, body: {}",
                        description, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent: {}", description);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert ({}): {}", description, e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled()
                && slackProperties.getWebhookUrl() != null
                && !slackProperties.getWebhookUrl().isBlank();
    }

    private String describe(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
