package com.example.alertscheduler.controller;

import com.example.alertscheduler.domain.enums.TimeSlot;
import com.example.alertscheduler.dto.ApiResponse;
import com.example.alertscheduler.dto.SendResultResponse;
import com.example.alertscheduler.service.ReminderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for on-demand reminders
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Send the fixed time-slot reminder immediately")
public class AlertController {

    private final ReminderService reminderService;

    @PostMapping("/send-now")
    @Operation(summary = "Send a reminder now", description = "Send the 6 PM or 9 PM reminder to Telegram immediately")
    public ResponseEntity<ApiResponse<SendResultResponse>> sendNow(
            @Parameter(description = "Time slot: 6pm or 9pm") @RequestParam String time) {
        var timeSlot = TimeSlot.fromCode(time);
        log.info("API: Send-now reminder for {}", timeSlot.getCode());

        var outcome = reminderService.sendReminder(timeSlot);
        var result = SendResultResponse.builder()
                .sent(outcome.isSent())
                .detail(outcome.getDetail())
                .time(timeSlot.getCode())
                .build();

        if (!outcome.isSent()) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.failure(result, outcome.getDetail()));
        }
        return ResponseEntity.ok(ApiResponse.success(result, outcome.getDetail()));
    }
}
