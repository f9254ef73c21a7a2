package com.example.alertscheduler.service;

import com.example.alertscheduler.config.AlertSchedulerProperties;
import com.example.alertscheduler.domain.enums.ParseMode;
import com.example.alertscheduler.domain.enums.TimeSlot;
import com.example.alertscheduler.service.dispatch.DispatchOutcome;
import com.example.alertscheduler.service.dispatch.TelegramDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Locale;

/**
 * Sends the fixed reminder for a time slot, independent of any schedule.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderService {

    private static final DateTimeFormatter NOW_FORMATTER = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM).withLocale(Locale.US);

    private final TelegramDispatcher telegramDispatcher;
    private final AlertSchedulerProperties properties;

    public DispatchOutcome sendReminder(TimeSlot timeSlot) {
        log.info("Sending {} reminder", timeSlot.getCode());
        return telegramDispatcher.send(buildReminderMessage(timeSlot), ParseMode.HTML);
    }

    String buildReminderMessage(TimeSlot timeSlot) {
        var now = ZonedDateTime.now(properties.getDefaultZoneId());

        return String.join("\n",
                "<b>Scheduled Reminder</b>",
                "Time slot: <b>" + timeSlot.getDisplayName() + "</b>",
                "Now: <code>" + NOW_FORMATTER.format(now) + "</code>",
                "",
                "<i>Do something now.</i>");
    }
}
