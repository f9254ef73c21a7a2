package com.example.alertscheduler.client;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * Result of a single delivery attempt against the Telegram Bot API.
 * <p>
 * The retry loop branches on {@link Kind} instead of catching exceptions.
 */
@Getter
@Builder
@ToString
public class DeliveryAttempt {

    /**
     * Statuses worth retrying besides 5xx: request timeout, too early, rate limited
     */
    static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 425, 429);

    public enum Kind {
        SUCCESS,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    private final Kind kind;

    /**
     * Diagnosable description: timeout, HTTP status with body, or transport error
     */
    private final String detail;

    /**
     * Error classification: TIMEOUT, TRANSPORT or HTTP_{status}
     */
    private final String errorType;

    /**
     * HTTP status code if a response was received
     */
    private final Integer httpStatusCode;

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE_FAILURE;
    }

    /**
     * Create a success result
     */
    public static DeliveryAttempt success(int statusCode) {
        return DeliveryAttempt.builder()
                .kind(Kind.SUCCESS)
                .detail("Telegram alert sent.")
                .httpStatusCode(statusCode)
                .build();
    }

    /**
     * The per-attempt deadline elapsed
     */
    public static DeliveryAttempt timeout(long timeoutMs) {
        return DeliveryAttempt.builder()
                .kind(Kind.RETRYABLE_FAILURE)
                .detail(String.format("Telegram request timed out after %dms", timeoutMs))
                .errorType("TIMEOUT")
                .build();
    }

    /**
     * Connection refused, DNS failure, reset connection and the like
     */
    public static DeliveryAttempt transportError(Throwable cause) {
        return DeliveryAttempt.builder()
                .kind(Kind.RETRYABLE_FAILURE)
                .detail("Telegram transport error: " + describe(cause))
                .errorType("TRANSPORT")
                .build();
    }

    /**
     * Non-success HTTP status. Retryable for 408, 425, 429 and any 5xx.
     */
    public static DeliveryAttempt httpFailure(int statusCode, String body) {
        return DeliveryAttempt.builder()
                .kind(isRetryableStatus(statusCode) ? Kind.RETRYABLE_FAILURE : Kind.FATAL_FAILURE)
                .detail(String.format("Telegram send failed: %d %s", statusCode, body != null ? body : "").trim())
                .errorType("HTTP_" + statusCode)
                .httpStatusCode(statusCode)
                .build();
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode >= 500 || RETRYABLE_STATUSES.contains(statusCode);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        var message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
