package com.example.alertscheduler.service.dispatch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a complete send, independent of how many attempts it took.
 */
@Getter
@ToString
@AllArgsConstructor
public class DispatchOutcome {

    private final boolean sent;
    private final String detail;

    public static DispatchOutcome sent(String detail) {
        return new DispatchOutcome(true, detail);
    }

    public static DispatchOutcome failed(String detail) {
        return new DispatchOutcome(false, detail);
    }

    /**
     * Failure caused by an exception, detail is the exception message
     */
    public static DispatchOutcome failed(Exception e) {
        var message = e.getMessage();
        return new DispatchOutcome(false, message != null ? message : e.getClass().getSimpleName());
    }
}
