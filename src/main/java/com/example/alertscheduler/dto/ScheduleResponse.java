package com.example.alertscheduler.dto;

import com.example.alertscheduler.domain.enums.ParseMode;
import com.example.alertscheduler.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private Long id;
    private String name;
    private String cronExpression;
    private String timezone;
    private String message;
    private ParseMode parseMode;
    private Boolean isActive;
    private Instant lastRunAt;
    private Instant lastSentAt;
    private RunStatus lastStatus;
    private String lastError;
    private Integer failureCount;
    private Instant createdAt;
    private Instant updatedAt;
}
