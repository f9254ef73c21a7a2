package com.example.alertscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Alert Scheduler Service Application
 * <p>
 * Delivers templated Telegram alerts on user-defined cron schedules.
 * <p>
 * Features:
 * - Persisted schedules with a live cron timer per active schedule
 * - Timeout-bounded delivery with exponential backoff retries
 * - Run history (last status, last error, consecutive failures) per schedule
 * - Slack alerting for schedules that keep failing
 * - On-demand sending of a schedule or a fixed time-slot reminder
 */
@EnableScheduling
@SpringBootApplication
public class AlertSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertSchedulerApplication.class, args);
    }
}
