package com.example.notificationscheduler.config;

import com.example.notificationscheduler.dto.CronJobResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * Shared-secret check for the cron endpoints.
 * <p>
 * Compares the header byte for byte, in constant time, and never logs secrets, only their
 * lengths and short hashes.
 */
@Slf4j
@RequiredArgsConstructor
public class CronSecretInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Cron-Secret";
    static final String SECRET_NOT_SET = "CRON_SECRET_NOT_SET";
    static final String AUTH_FAILED = "CRON_AUTH_FAILED";

    private final NotificationSchedulerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if (!properties.isCronSecretConfigured()) {
            log.error("[CronAuth] cron secret is not configured, rejecting {} {}", request.getMethod(), request.getRequestURI());
            reject(response, HttpStatus.INTERNAL_SERVER_ERROR, SECRET_NOT_SET);
            return false;
        }

        var expected = properties.getCronSecret();
        var provided = request.getHeader(HEADER);

        if (provided == null || provided.isEmpty()) {
            log.warn("[CronAuth] missing {} header on {} (expectedLen={})", HEADER, request.getRequestURI(), expected.length());
            reject(response, HttpStatus.UNAUTHORIZED, AUTH_FAILED);
            return false;
        }

        if (!MessageDigest.isEqual(provided.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[CronAuth] secret mismatch on {} (providedLen={} expectedLen={} providedHash={} expectedHash={})",
                    request.getRequestURI(), provided.length(), expected.length(), shortHash(provided), shortHash(expected));
            reject(response, HttpStatus.UNAUTHORIZED, AUTH_FAILED);
            return false;
        }

        return true;
    }

    private void reject(HttpServletResponse response, HttpStatus status, String code) throws IOException {
        var body = CronJobResponse.builder()
                .ok(false)
                .ts(clock.instant())
                .error(code)
                .build();
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }

    /**
     * First 8 hex characters of the SHA-256 digest
     */
    static String shortHash(String value) {
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
