package com.example.alertscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for cron timers, tick dispatching and async alerting.
 * <p>
 * Timer threads only hand ticks off to the dispatch pool, so a slow
 * delivery (timeouts plus backoff sleeps) never delays the timers of
 * other schedules.
 */
@Slf4j
@EnableAsync
@Configuration
public class SchedulerConfig {

    /**
     * Scheduler owning the live cron timers, one ScheduledFuture per active schedule.
     * Also drives Spring's @Scheduled methods.
     */
    @Bean(name = "cronTaskScheduler")
    public ThreadPoolTaskScheduler cronTaskScheduler(AlertSchedulerProperties properties) {
        log.info("Creating cron task scheduler with {} timer threads", properties.getTimerPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("cron-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in cron timer: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Bounded pool running tick dispatches.
     * In-flight deliveries are drained on shutdown, best effort.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(AlertSchedulerProperties properties) {
        log.info("Creating dispatch executor with {} threads", properties.getDispatchPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatchPoolSize());
        executor.setMaxPoolSize(properties.getDispatchPoolSize());
        executor.setQueueCapacity(properties.getDispatchQueueCapacity());
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation (Slack alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> log.warn("Async alert rejected, executor saturated"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }
}
