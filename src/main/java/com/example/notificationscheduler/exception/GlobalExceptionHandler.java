package com.example.notificationscheduler.exception;

import com.example.notificationscheduler.dto.CronJobResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;

/**
 * Global exception handler for the cron API.
 * Errors that escape the job runner still answer with the cron envelope and ok=false.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(JobExecutionException.class)
    public ResponseEntity<CronJobResponse> handleJobExecution(JobExecutionException ex) {
        log.error("Job failed: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(ex.getJobType().getJobName(), ex.getErrorCode()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<CronJobResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(null, "BAD_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CronJobResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(null, "INTERNAL_ERROR"));
    }

    private CronJobResponse error(String job, String code) {
        return CronJobResponse.builder()
                .ok(false)
                .job(job)
                .ts(clock.instant())
                .error(code)
                .build();
    }
}
