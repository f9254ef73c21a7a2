package com.example.alertscheduler.service.executor;

import com.example.alertscheduler.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron and timezone helpers shared by the engine and the schedule façade.
 * <p>
 * Accepts classic 5-field expressions (minute first) as well as Spring's
 * 6-field form (second first) and macros such as {@code @daily}.
 */
public final class CronExpressions {

    private CronExpressions() {
    }

    /**
     * Convert a 5-field expression to Spring's 6-field form by firing at second 0.
     */
    public static String normalize(String expression) {
        var trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        var fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : String.join(" ", fields);
    }

    /**
     * Check that the expression parses and fires at least once more in the given zone.
     *
     * @throws InvalidScheduleException if either value is unusable
     */
    public static void validate(String expression, String timezone) {
        var zone = parseZone(timezone);

        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("cronExpression", expression, "must not be blank");
        }

        CronExpression parsed;
        try {
            parsed = CronExpression.parse(normalize(expression));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("cronExpression", expression, e.getMessage());
        }

        if (parsed.next(ZonedDateTime.now(zone)) == null) {
            throw new InvalidScheduleException("cronExpression", expression, "has no upcoming fire time");
        }
    }

    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleException("timezone", timezone, "must not be blank");
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("timezone", timezone, e.getMessage());
        }
    }

    static CronTrigger trigger(String expression, String timezone) {
        var zone = parseZone(timezone);
        try {
            return new CronTrigger(normalize(expression), zone);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("cronExpression", expression, e.getMessage());
        }
    }
}
