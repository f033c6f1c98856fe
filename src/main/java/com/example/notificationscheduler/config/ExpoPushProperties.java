package com.example.notificationscheduler.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.expo-push")
public class ExpoPushProperties {
    @NotBlank
    private String baseUrl = "https://exp.host";
    @NotBlank
    private String sendPath = "/--/api/v2/push/send";
    private int timeoutSeconds = 15;
    @Min(1)
    @Max(100)
    private int chunkSize = 100;
    /**
     * Optional Expo access token, sent as a bearer token when present
     */
    private String accessToken;
}
