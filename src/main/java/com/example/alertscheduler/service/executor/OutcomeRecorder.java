package com.example.alertscheduler.service.executor;

import com.example.alertscheduler.config.AlertSchedulerProperties;
import com.example.alertscheduler.domain.enums.RunStatus;
import com.example.alertscheduler.domain.repository.ScheduleRepository;
import com.example.alertscheduler.service.alert.SlackAlertService;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Writes a dispatch outcome onto the schedule's run history.
 * <p>
 * Each outcome is a single UPDATE statement. User-editable fields are never touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeRecorder {

    private final ScheduleRepository scheduleRepository;
    private final SlackAlertService slackAlertService;
    private final AlertSchedulerProperties properties;

    /**
     * Apply an outcome to a schedule.
     *
     * @return false if the schedule no longer exists
     */
    @Transactional
    public boolean record(Long scheduleId, DispatchOutcome outcome) {
        var now = Instant.now();

        if (outcome.isSent()) {
            var updated = scheduleRepository.markSendSuccess(scheduleId, RunStatus.SUCCESS, now);
            logMissing(scheduleId, updated);
            return updated > 0;
        }

        var updated = scheduleRepository.markSendFailure(scheduleId, RunStatus.FAILED, outcome.getDetail(), now);
        logMissing(scheduleId, updated);
        if (updated > 0) {
            alertIfThresholdReached(scheduleId);
        }
        return updated > 0;
    }

    private void alertIfThresholdReached(Long scheduleId) {
        var threshold = properties.getFailureAlertThreshold();
        if (threshold <= 0) {
            return;
        }

        scheduleRepository.findById(scheduleId)
                .filter(schedule -> schedule.getFailureCount() == threshold)
                .ifPresent(schedule -> {
                    log.warn("Schedule {} failed {} times in a row, alerting on-call", scheduleId, threshold);
                    slackAlertService.sendScheduleFailingAlert(schedule);
                });
    }

    private void logMissing(Long scheduleId, int updated) {
        if (updated == 0) {
            log.warn("Schedule {} no longer exists, outcome not recorded", scheduleId);
        }
    }
}
