package com.example.notificationscheduler.service.push;

import com.example.notificationscheduler.client.ExpoPushClient;
import com.example.notificationscheduler.client.ExpoPushModels;
import com.example.notificationscheduler.client.ExpoPushModels.ExpoPushMessage;
import com.example.notificationscheduler.client.ExpoPushModels.ExpoPushTicket;
import com.example.notificationscheduler.config.ExpoPushProperties;
import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.repository.PushTokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Delivers push messages through Expo in chunks and classifies the per-message tickets.
 * <p>
 * Never throws for vendor or transport failures; they are logged and counted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PushGateway {

    private static final List<String> TOKEN_PREFIXES = List.of("ExponentPushToken[", "ExpoPushToken[", "ExpoToken[");

    private final ExpoPushClient expoPushClient;
    private final ExpoPushProperties properties;
    private final PushTokenRepository pushTokenRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public static boolean isValidToken(String token) {
        if (token == null || !token.endsWith("]")) {
            return false;
        }
        return TOKEN_PREFIXES.stream().anyMatch(token::startsWith);
    }

    public PushDeliveryResult send(List<PushMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return PushDeliveryResult.empty();
        }

        var valid = new ArrayList<ExpoPushMessage>();
        for (var message : messages) {
            if (isValidToken(message.to())) {
                valid.add(toExpoMessage(message));
            } else {
                log.warn("[ExpoPush] Dropping message with malformed token {}", mask(message.to()));
            }
        }
        var invalid = messages.size() - valid.size();

        if (valid.isEmpty()) {
            log.info("[ExpoPush] No valid Expo tokens to send to");
            metricsConfig.recordPushOutcome("invalid", invalid);
            return new PushDeliveryResult(messages.size(), invalid, 0, 0, 0);
        }

        var chunkSize = properties.getChunkSize();
        var chunkCount = (valid.size() + chunkSize - 1) / chunkSize;
        log.info("[ExpoPush] Sending {} messages in {} chunk(s)", valid.size(), chunkCount);

        var sent = 0;
        var failed = 0;
        var deactivated = 0;

        for (var start = 0; start < valid.size(); start += chunkSize) {
            var chunk = valid.subList(start, Math.min(start + chunkSize, valid.size()));
            var outcome = sendChunk(chunk);
            sent += outcome.sent();
            failed += outcome.failed();
            deactivated += outcome.deactivated();
        }

        metricsConfig.recordPushOutcome("invalid", invalid);
        metricsConfig.recordPushOutcome("sent", sent);
        metricsConfig.recordPushOutcome("failed", failed);
        metricsConfig.recordPushOutcome("deactivated", deactivated);

        return new PushDeliveryResult(messages.size(), invalid, sent, failed, deactivated);
    }

    private PushDeliveryResult sendChunk(List<ExpoPushMessage> chunk) {
        List<ExpoPushTicket> tickets;
        try {
            var response = expoPushClient.send(chunk);
            if (response.getErrors() != null && !response.getErrors().isEmpty()) {
                log.error("[ExpoPush] Request-level errors for chunk of {}: {}", chunk.size(), response.getErrors());
            }
            tickets = response.getData() != null ? response.getData() : List.of();
        } catch (RuntimeException e) {
            log.error("[ExpoPush] Error sending chunk of {}: {}", chunk.size(), e.getMessage());
            return new PushDeliveryResult(chunk.size(), 0, 0, chunk.size(), 0);
        }

        var sent = 0;
        var failed = 0;
        var deactivated = 0;

        for (var i = 0; i < chunk.size(); i++) {
            var token = chunk.get(i).getTo();
            if (i >= tickets.size()) {
                log.error("[ExpoPush] No ticket returned for token {}", mask(token));
                failed++;
                continue;
            }

            var ticket = tickets.get(i);
            if (ticket.isOk()) {
                sent++;
                continue;
            }

            failed++;
            log.error("[ExpoPush] Error for token {}: {} ({})", mask(token), ticket.getMessage(), ticket.getErrorCode());
            if (ExpoPushModels.DEVICE_NOT_REGISTERED.equals(ticket.getErrorCode()) && deactivate(token)) {
                deactivated++;
            }
        }

        return new PushDeliveryResult(chunk.size(), 0, sent, failed, deactivated);
    }

    private boolean deactivate(String token) {
        try {
            var updated = pushTokenRepository.deactivateByToken(token, clock.instant());
            log.info("[ExpoPush] Marked token inactive: {}", mask(token));
            return updated > 0;
        } catch (DataAccessException e) {
            log.error("[ExpoPush] Failed to deactivate token {}: {}", mask(token), e.getMessage());
            return false;
        }
    }

    private ExpoPushMessage toExpoMessage(PushMessage message) {
        return ExpoPushMessage.builder()
                .to(message.to())
                .title(message.title())
                .body(message.body())
                .data(message.data())
                .channelId(message.channel())
                .build();
    }

    private static String mask(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 16 ? token : token.substring(0, 16) + "...";
    }
}
