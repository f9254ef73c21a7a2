package com.example.alertscheduler.service.executor;

import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.domain.repository.ScheduleRepository;
import com.example.alertscheduler.exception.ScheduleNotFoundException;
import com.example.alertscheduler.service.alert.SlackAlertService;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the live cron timers, one per active schedule.
 * <p>
 * Features:
 * - Reconciliation of the timer registry against the schedule store
 * - Stop-then-start reinstall, so a schedule never holds two timers
 * - Tick hand-off from timer threads to the dispatch pool
 * - Overlapping ticks of the same schedule are skipped
 * - Tick failures are contained and never reach the timer thread
 * <p>
 * Registry mutations are serialized by a single lock.
 */
@Slf4j
@Service
public class CronExecutionEngine {

    static final String QUEUE_FULL_DETAIL = "Dispatch queue full; tick skipped";

    private final ScheduleRepository scheduleRepository;
    private final ScheduleExecutorService scheduleExecutorService;
    private final OutcomeRecorder outcomeRecorder;
    private final SlackAlertService slackAlertService;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor dispatchExecutor;

    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<Long, ScheduledFuture<?>> registry = new HashMap<>();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public CronExecutionEngine(ScheduleRepository scheduleRepository,
                               ScheduleExecutorService scheduleExecutorService,
                               OutcomeRecorder outcomeRecorder,
                               SlackAlertService slackAlertService,
                               @Qualifier("cronTaskScheduler") TaskScheduler taskScheduler,
                               @Qualifier("dispatchExecutor") TaskExecutor dispatchExecutor) {
        this.scheduleRepository = scheduleRepository;
        this.scheduleExecutorService = scheduleExecutorService;
        this.outcomeRecorder = outcomeRecorder;
        this.slackAlertService = slackAlertService;
        this.taskScheduler = taskScheduler;
        this.dispatchExecutor = dispatchExecutor;
    }

    // === Registry ===

    /**
     * Install a timer for every active schedule in the store.
     * A schedule whose timer cannot be built is logged and skipped.
     */
    public void reconcileAll() {
        registryLock.lock();
        try {
            var schedules = scheduleRepository.findAllByOrderByCreatedAtDesc();
            var installed = 0;
            for (var schedule : schedules) {
                if (!schedule.isActive()) {
                    continue;
                }
                try {
                    installTimer(schedule);
                    installed++;
                } catch (RuntimeException e) {
                    log.error("Could not install timer for schedule {} ({}): {}", schedule.getId(), schedule.getCronExpression(), e.getMessage());
                }
            }
            log.info("Reconciled {} schedules, {} timers installed", schedules.size(), installed);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * (Re)install the timer of a schedule. Any existing timer for the id is cancelled first.
     *
     * @throws ScheduleNotFoundException if the schedule does not exist
     */
    public void install(Long scheduleId) {
        registryLock.lock();
        try {
            var schedule = scheduleRepository.findById(scheduleId)
                    .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
            installTimer(schedule);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Cancel the timer of a schedule if it has one. Safe to call repeatedly.
     */
    public void uninstall(Long scheduleId) {
        registryLock.lock();
        try {
            var future = registry.remove(scheduleId);
            if (future != null) {
                future.cancel(false);
                log.info("Uninstalled timer for schedule {}", scheduleId);
            }
        } finally {
            registryLock.unlock();
        }
    }

    public Set<Long> registeredIds() {
        registryLock.lock();
        try {
            return Set.copyOf(registry.keySet());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Cancel every live timer. Ticks already handed to the dispatch pool are not interrupted.
     */
    public void shutdown() {
        registryLock.lock();
        try {
            registry.values().forEach(future -> future.cancel(false));
            log.info("Cancelled {} schedule timers", registry.size());
            registry.clear();
        } finally {
            registryLock.unlock();
        }
    }

    private void installTimer(Schedule schedule) {
        var scheduleId = schedule.getId();
        var trigger = CronExpressions.trigger(schedule.getCronExpression(), schedule.getTimezone());

        var previous = registry.remove(scheduleId);
        if (previous != null) {
            previous.cancel(false);
        }

        var future = taskScheduler.schedule(() -> onTick(scheduleId), trigger);
        registry.put(scheduleId, future);
        log.info("Installed timer for schedule {} [{} {}]", scheduleId, schedule.getCronExpression(), schedule.getTimezone());
    }

    // === Ticks ===

    /**
     * Timer callback. Only hands the tick to the dispatch pool.
     */
    void onTick(Long scheduleId) {
        try {
            dispatchExecutor.execute(() -> runTick(scheduleId));
        } catch (TaskRejectedException e) {
            log.warn("Dispatch pool saturated, skipping tick of schedule {}", scheduleId);
            try {
                var stillActive = scheduleRepository.findById(scheduleId)
                        .map(Schedule::isActive)
                        .orElse(false);
                if (stillActive) {
                    recordFailure(scheduleId, DispatchOutcome.failed(QUEUE_FULL_DETAIL));
                }
            } catch (RuntimeException lookupError) {
                log.error("Could not look up skipped tick of schedule {}: {}", scheduleId, lookupError.getMessage(), lookupError);
            }
        }
    }

    /**
     * Run one tick: re-read the schedule and deliver it if it is still active.
     * Never throws.
     */
    void runTick(Long scheduleId) {
        if (!inFlight.add(scheduleId)) {
            log.warn("Previous tick of schedule {} still running, skipping this one", scheduleId);
            return;
        }

        try {
            var schedule = scheduleRepository.findById(scheduleId).orElse(null);
            if (schedule == null) {
                log.debug("Schedule {} no longer exists, tick ignored", scheduleId);
                return;
            }
            if (!schedule.isActive()) {
                log.debug("Schedule {} is inactive, tick ignored", scheduleId);
                return;
            }

            scheduleExecutorService.dispatchAndRecord(schedule);
        } catch (Exception e) {
            log.error("Tick of schedule {} failed: {}", scheduleId, e.getMessage(), e);
            recordFailure(scheduleId, DispatchOutcome.failed(e));
            slackAlertService.sendErrorAlert("Schedule tick failed", "Schedule " + scheduleId + " could not be processed", e.toString());
        } finally {
            inFlight.remove(scheduleId);
        }
    }

    private void recordFailure(Long scheduleId, DispatchOutcome outcome) {
        try {
            outcomeRecorder.record(scheduleId, outcome);
        } catch (RuntimeException recordError) {
            log.error("Could not record failed tick of schedule {}: {}", scheduleId, recordError.getMessage(), recordError);
        }
    }
}
