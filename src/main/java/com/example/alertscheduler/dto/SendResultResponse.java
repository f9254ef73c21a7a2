package com.example.alertscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of an on-demand send (schedule send-now or time-slot reminder)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendResultResponse {

    private boolean sent;
    private String detail;

    /**
     * Set for schedule send-now
     */
    private Long scheduleId;

    /**
     * Set for reminders, e.g. "6pm"
     */
    private String time;
}
