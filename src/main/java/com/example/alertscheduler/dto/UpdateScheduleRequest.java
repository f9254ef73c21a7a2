package com.example.alertscheduler.dto;

import com.example.alertscheduler.domain.enums.ParseMode;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a partial schedule update. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Size(min = 1, max = 120, message = "Name must be 1 to 120 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    private String name;

    @Pattern(regexp = ".*\\S.*", message = "Cron expression must not be blank")
    private String cronExpression;

    @Pattern(regexp = ".*\\S.*", message = "Timezone must not be blank")
    private String timezone;

    @Pattern(regexp = "(?s).*\\S.*", message = "Message must not be blank")
    private String message;

    private ParseMode parseMode;

    private Boolean isActive;
}
