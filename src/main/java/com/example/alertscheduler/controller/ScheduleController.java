package com.example.alertscheduler.controller;

import com.example.alertscheduler.dto.*;
import com.example.alertscheduler.service.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for schedule management.
 * <p>
 * Provides endpoints for:
 * - Creating, updating and deleting schedules
 * - Listing and retrieving schedules with their run history
 * - Sending a schedule's message immediately
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "APIs for managing cron-driven Telegram alerts")
public class ScheduleController {

    private final ScheduleService scheduleService;

    @PostMapping
    @Operation(summary = "Create a schedule", description = "Create a schedule and start its timer when active")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        log.info("API: Create schedule '{}' [{}]", request.getName(), request.getCronExpression());

        var response = scheduleService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @GetMapping
    @Operation(summary = "List schedules", description = "List all schedules, newest first")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedules() {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.list()));
    }

    @GetMapping("/created")
    @Operation(summary = "List schedules by creation date", description = "Same listing as the collection, newest first")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> listSchedulesByCreation() {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.list()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get schedule by ID", description = "Retrieve a schedule with its last run status")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@Parameter(description = "Schedule ID") @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.get(id)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a schedule", description = "Update any subset of fields; the timer is reinstalled")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(
            @Parameter(description = "Schedule ID") @PathVariable Long id,
            @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("API: Update schedule {}", id);

        var response = scheduleService.update(id, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule updated successfully"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a schedule", description = "Stop the timer and remove the schedule")
    public ResponseEntity<ApiResponse<DeleteScheduleResponse>> deleteSchedule(@Parameter(description = "Schedule ID") @PathVariable Long id) {
        log.info("API: Delete schedule {}", id);

        var response = scheduleService.delete(id);
        return ResponseEntity.ok(ApiResponse.success(response, response.getMessage()));
    }

    @PostMapping("/{id}/send-now")
    @Operation(summary = "Send a schedule now", description = "Deliver the schedule's message immediately and record the outcome")
    public ResponseEntity<ApiResponse<SendResultResponse>> sendNow(@Parameter(description = "Schedule ID") @PathVariable Long id) {
        log.info("API: Send-now for schedule {}", id);

        var outcome = scheduleService.sendNow(id);
        var result = SendResultResponse.builder()
                .sent(outcome.isSent())
                .detail(outcome.getDetail())
                .scheduleId(id)
                .build();

        if (!outcome.isSent()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.failure(result, outcome.getDetail()));
        }
        return ResponseEntity.ok(ApiResponse.success(result, outcome.getDetail()));
    }
}
