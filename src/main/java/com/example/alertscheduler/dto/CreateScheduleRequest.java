package com.example.alertscheduler.dto;

import com.example.alertscheduler.domain.enums.ParseMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 120, message = "Name must be at most 120 characters")
    private String name;

    /**
     * 5-field or 6-field cron, e.g. "0 18 * * *"
     */
    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    /**
     * IANA timezone (default: the configured default timezone)
     */
    @Pattern(regexp = ".*\\S.*", message = "Timezone must not be blank")
    private String timezone;

    @NotBlank(message = "Message is required")
    private String message;

    /**
     * HTML (default) or MarkdownV2
     */
    private ParseMode parseMode;

    /**
     * Default: true
     */
    private Boolean isActive;
}
