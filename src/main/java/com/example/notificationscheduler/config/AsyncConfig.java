package com.example.notificationscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Async executor for fire-and-forget work such as Slack alerts.
 * <p>
 * Jobs themselves run on the request thread; only alerting leaves it.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Value("${notification-scheduler.alert-pool-size:4}")
    private int alertPoolSize;

    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring alert executor with {} threads", alertPoolSize);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(alertPoolSize);
        executor.setMaxPoolSize(alertPoolSize * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Alert rejected from async executor, dropping it"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
