package com.example.alertscheduler.config;

import com.example.alertscheduler.service.ScheduleService;
import com.example.alertscheduler.service.executor.CronExecutionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Seeds the default schedules and installs all timers on startup, before the
 * web server accepts requests. Cancels all timers on shutdown, after the web
 * server has stopped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleBootstrap implements SmartLifecycle {

    private final ScheduleService scheduleService;
    private final CronExecutionEngine cronExecutionEngine;
    private final AlertSchedulerProperties properties;

    private volatile boolean running;

    @Override
    public void start() {
        if (properties.isSeedDefaults()) {
            var seeded = scheduleService.seedDefaultsIfEmpty();
            if (seeded > 0) {
                log.info("Schedule store was empty, seeded {} default schedules", seeded);
            }
        }

        cronExecutionEngine.reconcileAll();
        running = true;
    }

    @Override
    public void stop() {
        log.info("Stopping schedule timers");
        cronExecutionEngine.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Lower than the web server's phase, so timers start first and stop last.
     */
    @Override
    public int getPhase() {
        return 0;
    }
}
