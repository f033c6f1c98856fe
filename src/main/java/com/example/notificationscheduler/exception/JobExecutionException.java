package com.example.notificationscheduler.exception;

import com.example.notificationscheduler.domain.enums.JobType;
import lombok.Getter;

/**
 * Wraps an unexpected failure inside a cron job run, carrying the job's stable error code.
 */
@Getter
public class JobExecutionException extends RuntimeException {

    private final JobType jobType;
    private final String errorCode;

    public JobExecutionException(JobType jobType, Throwable cause) {
        super(String.format("Job %s failed: %s", jobType.getJobName(), cause.getMessage()), cause);
        this.jobType = jobType;
        this.errorCode = jobType.getFailureCode();
    }
}
