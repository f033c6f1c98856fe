package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.config.CronSecretInterceptor;
import com.example.notificationscheduler.domain.enums.JobType;
import com.example.notificationscheduler.dto.CronJobResponse;
import com.example.notificationscheduler.service.health.CronHealthService;
import com.example.notificationscheduler.service.job.CronJobRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Cron trigger endpoints, called by the external scheduler.
 * <p>
 * Every route requires the X-Cron-Secret header (see {@code CronSecretInterceptor}).
 * Lease skips are successful responses; only job failures return HTTP 500.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/cron")
@Tag(name = "Cron Jobs", description = "Externally triggered notification jobs")
@SecurityScheme(name = CronJobController.CRON_SECRET_SCHEME, type = SecuritySchemeType.APIKEY,
        in = SecuritySchemeIn.HEADER, paramName = CronSecretInterceptor.HEADER, description = "Shared cron secret")
@SecurityRequirement(name = CronJobController.CRON_SECRET_SCHEME)
public class CronJobController {

    static final String CRON_SECRET_SCHEME = "cronSecret";

    private final CronJobRunner jobRunner;
    private final CronHealthService healthService;

    @PostMapping("/reminders/run")
    @Operation(summary = "Send event reminders", description = "Reminders for events entering each offset window")
    public ResponseEntity<CronJobResponse> runReminders() {
        return respond(jobRunner.run(JobType.REMINDERS));
    }

    @PostMapping("/digest/run")
    @Operation(summary = "Send daily digests", description = "Digest for recipients whose local digest time is now")
    public ResponseEntity<CronJobResponse> runDigest() {
        return respond(jobRunner.run(JobType.DIGEST));
    }

    @PostMapping({"/cleanup/tokens", "/tokens/cleanup"})
    @Operation(summary = "Push token retention", description = "Deactivate stale tokens and delete long-inactive ones")
    public ResponseEntity<CronJobResponse> cleanupTokens() {
        return respond(jobRunner.run(JobType.TOKEN_CLEANUP));
    }

    @PostMapping({"/cleanup/dedupe", "/notifications/dedupe/cleanup"})
    @Operation(summary = "Delivery log retention", description = "Delete old delivery log entries")
    public ResponseEntity<CronJobResponse> cleanupDedupe() {
        return respond(jobRunner.run(JobType.DEDUPE_CLEANUP));
    }

    @PostMapping("/cleanup/sessions")
    @Operation(summary = "Session retention", description = "Delete sessions expired past the grace period")
    public ResponseEntity<CronJobResponse> cleanupSessions() {
        return respond(jobRunner.run(JobType.SESSION_CLEANUP));
    }

    @GetMapping("/health")
    @Operation(summary = "Cron health", description = "Validates the cron secret and database connectivity")
    public ResponseEntity<CronJobResponse> health() {
        return ResponseEntity.ok(healthService.check());
    }

    private ResponseEntity<CronJobResponse> respond(CronJobResponse response) {
        var status = response.isOk() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }
}
