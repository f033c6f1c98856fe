package com.example.notificationscheduler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final NotificationSchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new CronSecretInterceptor(properties, objectMapper, clock))
                .addPathPatterns("/api/cron/**");
    }
}
