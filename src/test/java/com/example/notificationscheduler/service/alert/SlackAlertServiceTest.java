package com.example.notificationscheduler.service.alert;

import com.example.notificationscheduler.config.SlackProperties;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.service.lease.LeaseFailurePolicy;
import com.slack.api.Slack;
import com.slack.api.webhook.Payload;
import com.slack.api.webhook.WebhookResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlackAlertService Tests")
class SlackAlertServiceTest {

    private static final String WEBHOOK = "https://hooks.slack.test/services/T000/B000/XXX";

    @Mock
    private Slack slack;

    private SlackProperties properties;
    private SlackAlertService alertService;

    @BeforeEach
    void setUp() {
        properties = new SlackProperties();
        properties.setEnabled(true);
        properties.setWebhookUrl(WEBHOOK);
        properties.setEnvironment("prod");
        alertService = new SlackAlertService(properties, slack);
    }

    @Test
    @DisplayName("Should post job failures to the webhook")
    void shouldSendJobFailure() throws IOException {
        var payload = ArgumentCaptor.forClass(Payload.class);
        when(slack.send(eq(WEBHOOK), payload.capture())).thenReturn(WebhookResponse.builder().code(200).body("ok").build());

        alertService.sendJobFailureAlert(JobType.DIGEST, "DIGEST_RUN_FAILED", new IllegalStateException("db down"));

        assertThat(payload.getValue().getText()).contains("[prod]").contains("digest");
        assertThat(payload.getValue().getAttachments().get(0).getFields())
                .anySatisfy(field -> assertThat(field.getValue()).isEqualTo("DIGEST_RUN_FAILED"));
    }

    @Test
    @DisplayName("Should describe the lease policy consequence")
    void shouldSendLeaseError() throws IOException {
        var payload = ArgumentCaptor.forClass(Payload.class);
        when(slack.send(eq(WEBHOOK), payload.capture())).thenReturn(WebhookResponse.builder().code(200).build());

        alertService.sendLeaseErrorAlert("reminders", LeaseFailurePolicy.FAIL_OPEN, new RuntimeException("timeout"));

        assertThat(payload.getValue().getAttachments().get(0).getText()).isEqualTo("Job is running without a lease.");
    }

    @Test
    @DisplayName("Should not call Slack when alerting is disabled")
    void shouldSkipWhenDisabled() {
        properties.setEnabled(false);

        alertService.sendJobFailureAlert(JobType.REMINDERS, "REMINDERS_RUN_FAILED", null);

        verifyNoInteractions(slack);
    }

    @Test
    @DisplayName("Should swallow webhook failures")
    void shouldNotThrowOnWebhookFailure() throws IOException {
        when(slack.send(eq(WEBHOOK), any(Payload.class))).thenThrow(new IOException("connect timed out"));

        assertThatCode(() -> alertService.sendLeaseErrorAlert("digest", LeaseFailurePolicy.FAIL_CLOSED, null))
                .doesNotThrowAnyException();
        verify(slack).send(eq(WEBHOOK), any(Payload.class));
    }
}
