package com.example.alertscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Fixed reminder slots that can be sent on demand.
 */
@Getter
@RequiredArgsConstructor
public enum TimeSlot {

    SIX_PM("6pm", "6:00 PM"),

    NINE_PM("9pm", "9:00 PM");

    private final String code;
    private final String displayName;

    /**
     * Find TimeSlot by its query code ("6pm" or "9pm")
     */
    public static TimeSlot fromCode(String code) {
        for (var slot : values()) {
            if (slot.getCode().equals(code)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("time must be one of: 6pm, 9pm");
    }
}
