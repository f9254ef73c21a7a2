package com.example.alertscheduler.domain.enums;

/**
 * Result of the most recent delivery attempt of a schedule.
 */
public enum RunStatus {

    /**
     * The message reached Telegram.
     */
    SUCCESS,

    /**
     * Delivery failed after retries, or failed with a non-retryable error.
     */
    FAILED
}
