package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.domain.enums.JobType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for cron jobs.
 * <p>
 * Discovers all CronJob beans and provides lookup by job type.
 */
@Slf4j
@Component
public class CronJobRegistry {

    private final Map<JobType, CronJob> jobs = new EnumMap<>(JobType.class);
    private final List<CronJob> jobBeans;

    public CronJobRegistry(List<CronJob> jobBeans) {
        this.jobBeans = jobBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var job : jobBeans) {
            var type = job.getJobType();
            if (jobs.containsKey(type)) {
                throw new IllegalStateException("Duplicate cron job for " + type + ": "
                        + job.getClass().getSimpleName() + " and " + jobs.get(type).getClass().getSimpleName());
            }
            jobs.put(type, job);
            log.info("Registered cron job {}: {}", type.getJobName(), job.getClass().getSimpleName());
        }

        for (var type : JobType.values()) {
            if (!jobs.containsKey(type)) {
                log.warn("No cron job registered for: {}", type.getJobName());
            }
        }
    }

    public Optional<CronJob> getJob(JobType jobType) {
        return Optional.ofNullable(jobs.get(jobType));
    }

    /**
     * @throws IllegalArgumentException if no job is registered for the type
     */
    public CronJob getJobOrThrow(JobType jobType) {
        return getJob(jobType).orElseThrow(() -> new IllegalArgumentException("No cron job registered for: " + jobType));
    }

    public Set<JobType> getRegisteredTypes() {
        return jobs.keySet();
    }
}
