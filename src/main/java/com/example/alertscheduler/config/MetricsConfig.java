package com.example.alertscheduler.config;

import com.example.alertscheduler.domain.repository.ScheduleRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring alert delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Telegram send outcomes (one success or failure per send)
 * - Telegram retries (one per retried attempt)
 * - Number of active schedules
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    static final String SEND_TOTAL = "telegram_alert_send_total";
    static final String SEND_RETRY_TOTAL = "telegram_alert_send_retry_total";
    static final String ACTIVE_SCHEDULES = "alert_scheduler_active_schedules";

    private final MeterRegistry meterRegistry;
    private final ScheduleRepository scheduleRepository;

    private final AtomicLong activeSchedules = new AtomicLong(0);

    private Counter sendSuccessCounter;
    private Counter sendFailureCounter;
    private Counter sendRetryCounter;

    @PostConstruct
    public void initializeMetrics() {
        // Registered up front so the series exist at zero before the first send
        sendSuccessCounter = Counter.builder(SEND_TOTAL)
                .tag("result", "success")
                .description("Total number of Telegram send outcomes grouped by result")
                .register(meterRegistry);
        sendFailureCounter = Counter.builder(SEND_TOTAL)
                .tag("result", "failure")
                .description("Total number of Telegram send outcomes grouped by result")
                .register(meterRegistry);
        sendRetryCounter = Counter.builder(SEND_RETRY_TOTAL)
                .description("Total number of Telegram send retries")
                .register(meterRegistry);

        Gauge.builder(ACTIVE_SCHEDULES, activeSchedules, AtomicLong::get)
                .description("Number of active schedules")
                .register(meterRegistry);
    }

    /**
     * Periodically update the active schedule gauge from the database
     */
    @Scheduled(fixedDelayString = "${alert-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            activeSchedules.set(scheduleRepository.countByActiveTrue());
        } catch (Exception e) {
            log.warn("Could not refresh schedule gauges: {}", e.getMessage());
        }
    }

    public void recordSendSuccess() {
        sendSuccessCounter.increment();
    }

    public void recordSendFailure() {
        sendFailureCounter.increment();
    }

    public void recordSendRetry() {
        sendRetryCounter.increment();
    }
}
