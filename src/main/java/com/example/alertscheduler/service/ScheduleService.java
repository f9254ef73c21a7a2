package com.example.alertscheduler.service;

import com.example.alertscheduler.config.AlertSchedulerProperties;
import com.example.alertscheduler.domain.entity.Schedule;
import com.example.alertscheduler.domain.enums.ParseMode;
import com.example.alertscheduler.domain.repository.ScheduleRepository;
import com.example.alertscheduler.dto.CreateScheduleRequest;
import com.example.alertscheduler.dto.DeleteScheduleResponse;
import com.example.alertscheduler.dto.ScheduleResponse;
import com.example.alertscheduler.dto.UpdateScheduleRequest;
import com.example.alertscheduler.exception.ScheduleNotFoundException;
import com.example.alertscheduler.mapper.ScheduleMapper;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import com.example.alertscheduler.service.executor.CronExecutionEngine;
import com.example.alertscheduler.service.executor.CronExpressions;
import com.example.alertscheduler.service.executor.ScheduleExecutorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Scheduling façade: every mutation of the store is followed by the matching
 * timer reconciliation.
 * <p>
 * Provides:
 * - Schedule creation, update and deletion
 * - Schedule listing and lookup
 * - Immediate delivery of a schedule (send-now)
 * - Seeding of the default schedules on an empty store
 * <p>
 * Mutations are not wrapped in a transaction so the row is committed before
 * its timer is installed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    static final String DEFAULT_MESSAGE = "<b>Do something now.</b>";

    private final ScheduleRepository scheduleRepository;
    private final CronExecutionEngine cronExecutionEngine;
    private final ScheduleExecutorService scheduleExecutorService;
    private final ScheduleMapper scheduleMapper;
    private final AlertSchedulerProperties properties;

    // === Mutations ===

    /**
     * Create a schedule and start its timer when active.
     *
     * @throws com.example.alertscheduler.exception.InvalidScheduleException for a bad cron or timezone
     */
    public ScheduleResponse create(CreateScheduleRequest request) {
        var timezone = request.getTimezone() != null ? request.getTimezone() : properties.getDefaultTimezone();
        CronExpressions.validate(request.getCronExpression(), timezone);

        var schedule = Schedule.builder()
                .name(request.getName())
                .cronExpression(request.getCronExpression().trim())
                .timezone(timezone)
                .message(request.getMessage())
                .parseMode(request.getParseMode() != null ? request.getParseMode() : ParseMode.HTML)
                .active(request.getIsActive() == null || request.getIsActive())
                .build();

        schedule = scheduleRepository.save(schedule);
        log.info("Created schedule {} '{}' [{} {}]", schedule.getId(), schedule.getName(), schedule.getCronExpression(), schedule.getTimezone());

        if (schedule.isActive()) {
            cronExecutionEngine.install(schedule.getId());
        }
        return scheduleMapper.toResponse(schedule);
    }

    /**
     * Apply the non-null fields of the request, then reinstall the timer.
     * The timer is always stopped and restarted, whatever fields changed.
     * Only the editable columns are written, so run history recorded by a
     * concurrent tick survives the update.
     */
    public ScheduleResponse update(Long scheduleId, UpdateScheduleRequest request) {
        var current = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        var cronExpression = request.getCronExpression() != null ? request.getCronExpression().trim() : current.getCronExpression();
        var timezone = request.getTimezone() != null ? request.getTimezone() : current.getTimezone();
        CronExpressions.validate(cronExpression, timezone);

        var updated = scheduleRepository.updateEditableFields(scheduleId,
                request.getName() != null ? request.getName() : current.getName(),
                cronExpression,
                timezone,
                request.getMessage() != null ? request.getMessage() : current.getMessage(),
                request.getParseMode() != null ? request.getParseMode() : current.getParseMode(),
                request.getIsActive() != null ? request.getIsActive() : current.isActive(),
                Instant.now());
        if (updated == 0) {
            throw new ScheduleNotFoundException(scheduleId);
        }

        var schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        log.info("Updated schedule {} (active={})", scheduleId, schedule.isActive());

        cronExecutionEngine.uninstall(scheduleId);
        if (schedule.isActive()) {
            cronExecutionEngine.install(scheduleId);
        }
        return scheduleMapper.toResponse(schedule);
    }

    public DeleteScheduleResponse delete(Long scheduleId) {
        if (!scheduleRepository.existsById(scheduleId)) {
            throw new ScheduleNotFoundException(scheduleId);
        }

        cronExecutionEngine.uninstall(scheduleId);
        scheduleRepository.deleteById(scheduleId);
        log.info("Deleted schedule {}", scheduleId);

        return DeleteScheduleResponse.builder()
                .success(true)
                .id(scheduleId)
                .message("Schedule deleted.")
                .build();
    }

    // === Queries ===

    @Transactional(readOnly = true)
    public List<ScheduleResponse> list() {
        return scheduleMapper.toResponseList(scheduleRepository.findAllByOrderByCreatedAtDesc());
    }

    @Transactional(readOnly = true)
    public ScheduleResponse get(Long scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .map(scheduleMapper::toResponse)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
    }

    // === Delivery ===

    /**
     * Deliver a schedule's message now, whether or not it is active.
     * The outcome is recorded exactly as for a cron tick.
     */
    public DispatchOutcome sendNow(Long scheduleId) {
        var schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));

        log.info("Send-now requested for schedule {}", scheduleId);
        return scheduleExecutorService.dispatchAndRecord(schedule);
    }

    /**
     * Insert the default 6 PM and 9 PM schedules if the store holds none.
     * Timers are not installed here; the caller reconciles afterwards.
     *
     * @return number of schedules inserted
     */
    public int seedDefaultsIfEmpty() {
        if (scheduleRepository.count() > 0) {
            return 0;
        }

        var timezone = properties.getDefaultTimezone();
        var defaults = List.of(
                defaultSchedule("Default 6 PM Alert", "0 18 * * *", timezone),
                defaultSchedule("Default 9 PM Alert", "0 21 * * *", timezone));

        scheduleRepository.saveAll(defaults);
        log.info("Seeded {} default schedules in {}", defaults.size(), timezone);
        return defaults.size();
    }

    private Schedule defaultSchedule(String name, String cronExpression, String timezone) {
        return Schedule.builder()
                .name(name)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .message(DEFAULT_MESSAGE)
                .parseMode(ParseMode.HTML)
                .active(true)
                .build();
    }
}
