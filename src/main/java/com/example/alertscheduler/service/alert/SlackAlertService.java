package com.example.alertscheduler.service.alert;

import com.example.alertscheduler.config.SlackProperties;
import com.example.alertscheduler.domain.entity.Schedule;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Service for sending operator alerts to Slack when schedules keep failing.
 * <p>
 * Alerts run asynchronously so a slow webhook never delays the dispatch
 * path that triggered them.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneId.systemDefault());

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:alert-scheduler}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a schedule whose consecutive failures reached the threshold.
     */
    @Async
    public void sendScheduleFailingAlert(Schedule schedule) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Schedule {} is failing but no alert was sent.", schedule.getId());
            return;
        }

        try {
            var payload = buildScheduleFailingPayload(schedule);
            var response = slack.send(slackProperties.getWebhookUrl(), payload);

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failing schedule {}", schedule.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for schedule {}: {}", schedule.getId(), e.getMessage(), e);
        }
    }

    /**
     * Send generic error alert
     */
    @Async
    public void sendErrorAlert(String title, String message, String details) {
        if (!isConfigured()) {
            log.warn("Slack alerting disabled. Error alert not sent: {}", title);
            return;
        }

        try {
            var payload = Payload.builder()
                    .channel(slackProperties.getChannel())
                    .username(applicationName)
                    .iconEmoji(":warning:")
                    .text(":warning: *" + title + "*")
                    .attachments(List.of(
                            Attachment.builder()
                                    .color("warning")
                                    .text(message)
                                    .fields(details != null ? List.of(
                                            Field.builder()
                                                    .title("Details")
                                                    .value(truncate(details, 500))
                                                    .valueShortEnough(false)
                                                    .build()
                                    ) : List.of())
                                    .footer(applicationName)
                                    .ts(String.valueOf(Instant.now().getEpochSecond()))
                                    .build()
                    ))
                    .build();

            slack.send(slackProperties.getWebhookUrl(), payload);
        } catch (Exception e) {
            log.error("Error sending Slack error alert: {}", e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildScheduleFailingPayload(Schedule schedule) {
        var scheduleId = String.valueOf(schedule.getId());
        var lastError = schedule.getLastError() != null ? schedule.getLastError() : "Unknown error";
        var lastRunAt = schedule.getLastRunAt() != null ? DATE_FORMATTER.format(schedule.getLastRunAt()) : "never";

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Scheduled Alert Failing - Telegram delivery keeps failing*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(schedule.getName() + " (#" + scheduleId + ")")
                                .titleLink(buildScheduleLink(scheduleId))
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Schedule ID")
                                                .value(scheduleId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Cron")
                                                .value(schedule.getCronExpression() + " (" + schedule.getTimezone() + ")")
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Consecutive Failures")
                                                .value(String.valueOf(schedule.getFailureCount()))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Run At")
                                                .value(lastRunAt)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(lastError, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Check the bot token, chat id and Telegram availability")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String buildScheduleLink(String scheduleId) {
        return slackProperties.getDashboardBaseUrl() + "/api/v1/schedules/" + scheduleId;
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
