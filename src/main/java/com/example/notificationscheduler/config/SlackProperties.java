package com.example.notificationscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack alerting properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#notifications-oncall";
    private boolean enabled = false;
    /**
     * Prefix for alert titles, usually the deployment environment
     */
    private String environment = "local";
}
