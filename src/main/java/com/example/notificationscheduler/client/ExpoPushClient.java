package com.example.notificationscheduler.client;

import com.example.notificationscheduler.client.ExpoPushModels.ExpoPushMessage;
import com.example.notificationscheduler.client.ExpoPushModels.ExpoPushResponse;
import com.example.notificationscheduler.config.ExpoPushProperties;
import com.example.notificationscheduler.exception.ExternalServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Client for the Expo push send API.
 * <p>
 * Uses:
 * - Resilience4j Circuit Breaker for fault tolerance (no retry: a resend could duplicate a push)
 * - WebClient for HTTP calls
 * <p>
 * The response body is parsed even for non-2xx statuses, because Expo reports
 * per-message tickets alongside request-level errors.
 */
@Slf4j
@Component
public class ExpoPushClient {

    private static final String SERVICE_NAME = "Expo Push";

    private final WebClient webClient;
    private final ExpoPushProperties properties;
    private final ObjectMapper objectMapper;

    public ExpoPushClient(@Qualifier("expoPushWebClient") WebClient webClient,
                          ExpoPushProperties properties,
                          ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Send one chunk of messages.
     *
     * @param messages at most the configured chunk size
     * @return the parsed tickets, possibly with request-level errors
     * @throws ExternalServiceException on transport failure or an unparseable response
     */
    @CircuitBreaker(name = "expoPush", fallbackMethod = "sendFallback")
    public ExpoPushResponse send(List<ExpoPushMessage> messages) {
        log.debug("Calling Expo push API with {} message(s)", messages.size());

        try {
            return webClient.post()
                    .uri(properties.getSendPath())
                    .bodyValue(messages)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> {
                                var status = response.statusCode().value();
                                if (response.statusCode().isError()) {
                                    log.warn("Expo push API returned HTTP {}: {}", status, body);
                                }
                                return Mono.just(parse(status, body));
                            }))
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to send push chunk of {}: {}", messages.size(), e.getMessage());
            throw ExternalServiceException.transport(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when the circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private ExpoPushResponse sendFallback(List<ExpoPushMessage> messages, Exception e) {
        if (e instanceof ExternalServiceException externalServiceException) {
            throw externalServiceException;
        }
        log.warn("Circuit breaker open for Expo push, dropping chunk of {}: {}", messages.size(), e.getMessage());
        throw ExternalServiceException.unavailable(SERVICE_NAME, e);
    }

    private ExpoPushResponse parse(int status, String body) {
        if (body.isBlank()) {
            throw ExternalServiceException.badResponse(SERVICE_NAME, status, body);
        }
        try {
            return objectMapper.readValue(body, ExpoPushResponse.class);
        } catch (JsonProcessingException e) {
            throw ExternalServiceException.badResponse(SERVICE_NAME, status, body);
        }
    }
}
