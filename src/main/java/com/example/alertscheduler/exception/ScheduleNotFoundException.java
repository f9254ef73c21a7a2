package com.example.alertscheduler.exception;

import lombok.Getter;

/**
 * Exception for schedule not found
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final Long scheduleId;

    public ScheduleNotFoundException(Long scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }
}
