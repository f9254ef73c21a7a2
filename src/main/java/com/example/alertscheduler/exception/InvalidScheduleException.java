package com.example.alertscheduler.exception;

import lombok.Getter;

/**
 * Exception for a schedule whose cron expression or timezone cannot be used
 */
@Getter
public class InvalidScheduleException extends RuntimeException {

    private final String field;
    private final String value;

    public InvalidScheduleException(String field, String value, String reason) {
        super(String.format("Invalid %s '%s': %s", field, value, reason));
        this.field = field;
        this.value = value;
    }
}
