package com.example.alertscheduler.service.executor;

import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import com.example.alertscheduler.service.dispatch.TelegramDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs one delivery of a schedule's message and records the outcome.
 * <p>
 * This is the single path shared by cron ticks and send-now, so both
 * produce identical run history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleExecutorService {

    private final TelegramDispatcher telegramDispatcher;
    private final OutcomeRecorder outcomeRecorder;

    /**
     * Dispatch the schedule's message and record the outcome.
     * Exceptions raised while dispatching become a FAILED outcome.
     *
     * @param schedule a snapshot of the schedule to deliver
     * @return the outcome that was recorded
     */
    public DispatchOutcome dispatchAndRecord(Schedule schedule) {
        var scheduleId = schedule.getId();
        var startTime = Instant.now();
        log.info("Dispatching schedule {} ({})", scheduleId, schedule.getName());

        DispatchOutcome outcome;
        try {
            outcome = telegramDispatcher.send(schedule.getMessage(), schedule.getParseMode());
        } catch (Exception e) {
            log.error("Unexpected error dispatching schedule {}: {}", scheduleId, e.getMessage(), e);
            outcome = DispatchOutcome.failed(e);
        }

        outcomeRecorder.record(scheduleId, outcome);

        var durationMs = Duration.between(startTime, Instant.now()).toMillis();
        if (outcome.isSent()) {
            log.info("Schedule {} sent in {}ms", scheduleId, durationMs);
        } else {
            log.error("Schedule {} failed to send Telegram message after {}ms: {}", scheduleId, durationMs, outcome.getDetail());
        }
        return outcome;
    }
}
