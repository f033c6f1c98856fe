package com.example.notificationscheduler.exception;

import lombok.Getter;

/**
 * A call to an external service produced no usable answer.
 * <p>
 * {@link #getHttpStatusCode()} is set only when a response arrived but could not be read.
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private static final int MAX_BODY_IN_MESSAGE = 300;

    public enum Kind {
        /** Connection, timeout or I/O failure before a response was read */
        TRANSPORT,
        /** A response arrived with an empty or unreadable body */
        BAD_RESPONSE,
        /** The circuit breaker refused the call */
        UNAVAILABLE
    }

    private final String serviceName;
    private final Kind kind;
    private final Integer httpStatusCode;

    private ExternalServiceException(String serviceName, Kind kind, Integer httpStatusCode, String detail, Throwable cause) {
        super("[" + serviceName + "] " + kind + ": " + detail, cause);
        this.serviceName = serviceName;
        this.kind = kind;
        this.httpStatusCode = httpStatusCode;
    }

    public static ExternalServiceException transport(String serviceName, Throwable cause) {
        return new ExternalServiceException(serviceName, Kind.TRANSPORT, null, String.valueOf(cause.getMessage()), cause);
    }

    public static ExternalServiceException badResponse(String serviceName, int httpStatusCode, String body) {
        var shown = body == null || body.isBlank() ? "empty response body" : abbreviate(body);
        return new ExternalServiceException(serviceName, Kind.BAD_RESPONSE, httpStatusCode, "HTTP " + httpStatusCode + " " + shown, null);
    }

    public static ExternalServiceException unavailable(String serviceName, Throwable cause) {
        return new ExternalServiceException(serviceName, Kind.UNAVAILABLE, null, "circuit breaker open", cause);
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
