package com.example.alertscheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Configuration properties for the alert scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "alert-scheduler")
public class AlertSchedulerProperties {

    /**
     * Timezone for schedules created without one and for reminder timestamps
     */
    @NotBlank
    private String defaultTimezone = "Asia/Phnom_Penh";

    /**
     * Seed the 6 PM and 9 PM schedules when the store is empty at startup
     */
    private boolean seedDefaults = true;

    /**
     * Threads firing cron timers. Ticks are handed off, so this stays small.
     */
    @Min(1)
    private int timerPoolSize = 2;

    /**
     * Threads running dispatches (HTTP attempts and backoff sleeps)
     */
    @Min(1)
    private int dispatchPoolSize = 8;

    @Min(1)
    private int dispatchQueueCapacity = 100;

    /**
     * Consecutive failures of a schedule that trigger a Slack alert (0 = never)
     */
    @Min(0)
    private int failureAlertThreshold = 3;

    @AssertTrue(message = "default-timezone must be a valid IANA timezone")
    public boolean isDefaultTimezoneValid() {
        if (defaultTimezone == null) {
            return true;
        }
        try {
            ZoneId.of(defaultTimezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    public ZoneId getDefaultZoneId() {
        return ZoneId.of(defaultTimezone);
    }
}
