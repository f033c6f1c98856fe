package com.example.notificationscheduler.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request/Response DTOs for the Expo push API
 */
public class ExpoPushModels {
    private ExpoPushModels() {
    }

    public static final String DEVICE_NOT_REGISTERED = "DeviceNotRegistered";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExpoPushMessage {
        private String to;
        private String title;
        private String body;
        private Map<String, Object> data;
        @Builder.Default
        private String sound = "default";
        private String channelId;
    }

    /**
     * Send response: one ticket per message, in request order
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExpoPushResponse {
        private List<ExpoPushTicket> data;
        private List<ExpoRequestError> errors;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExpoPushTicket {
        private String status;
        private String id;
        private String message;
        private ExpoTicketDetails details;

        public boolean isOk() {
            return "ok".equals(status);
        }

        public String getErrorCode() {
            return details != null ? details.getError() : null;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExpoTicketDetails {
        /**
         * DeviceNotRegistered, InvalidCredentials, MessageTooBig or MessageRateExceeded
         */
        private String error;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExpoRequestError {
        private String code;
        private String message;
    }
}
