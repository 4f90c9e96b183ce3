package com.example.emailscheduler.service.alert;

import com.example.emailscheduler.config.SlackProperties;
import com.example.emailscheduler.domain.entity.ExecutionLock;
import com.example.emailscheduler.domain.entity.ProcessingSchedule;
import com.example.emailscheduler.domain.entity.ScheduleExecution;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sends operator alerts to Slack.
 * <p>
 * Alerts are sent for executions that exhausted their attempts, execution
 * locks that could not be released, and locks left behind by crashed instances.
 * All sends are asynchronous so they never delay schedule processing.
 */
@Slf4j
@Service
public class SlackAlertService {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z").withZone(ZoneOffset.UTC);

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:email-scheduler}")
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
     * Alert for an execution whose due instant has run out of attempts.
     */
    @Async
    public void sendExecutionFailedAlert(ProcessingSchedule schedule, ScheduleExecution execution) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Schedule {} exhausted its attempts but no alert was sent.",
                    schedule.getId());
            return;
        }

        var scheduleId = schedule.getId().toString();
        var error = execution.getErrorMessage() != null ? execution.getErrorMessage() : "Unknown error";

        var payload = Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Email Processing Schedule Failed - Attempts Exhausted*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(schedule.getName() + " (" + schedule.getType().getDisplayName() + ")")
                                .titleLink(buildScheduleLink(scheduleId))
                                .fields(Arrays.asList(
                                        shortField("Schedule ID", scheduleId),
                                        shortField("Account", schedule.getAccountId()),
                                        shortField("Due At", format(execution.getScheduledFor())),
                                        shortField("Attempt", execution.getAttemptNumber() + " of " + execution.getMaxAttempts()),
                                        Field.builder()
                                                .title("Last Error")
                                                .value("```" + truncate(error, 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Please investigate the account and re-run the schedule")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();

        send(payload, "execution failure of schedule " + scheduleId);
    }

    /**
     * Alert for an execution lock whose release failed; the instant stays claimed until removed.
     */
    @Async
    public void sendLockReleaseFailedAlert(Instant executionTime, String errorMessage) {
        sendErrorAlert("Execution Lock Release Failed",
                "The execution lock for " + format(executionTime) + " could not be released and must be removed manually.",
                errorMessage);
    }

    /**
     * Alert listing execution locks older than the stale threshold.
     */
    @Async
    public void sendStaleLocksAlert(List<ExecutionLock> staleLocks, boolean reclaimed) {
        var details = staleLocks.stream()
                .map(lock -> String.format("%s held by %s since %s", format(lock.getExecutionTime()),
                        lock.getLockedBy(), format(lock.getCreatedAt())))
                .collect(Collectors.joining("\n"));

        var message = reclaimed
                ? String.format("%d stale execution lock(s) were removed. Their schedules run on the next poll.", staleLocks.size())
                : String.format("%d execution lock(s) look stale. Schedules due at these instants will not run until the locks are removed.",
                staleLocks.size());

        sendErrorAlert("Stale Execution Locks", message, details);
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

        send(payload, title);
    }

    private void send(Payload payload, String description) {
        try {
            var response = slack.send(slackProperties.getWebhookUrl(), payload);
            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert for {}. Response code: {}, body: {}",
                        description, response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for {}", description);
            }
        } catch (IOException e) {
            log.error("Error sending Slack alert for {}: {}", description, e.getMessage(), e);
        }
    }

    private boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    private static Field shortField(String title, String value) {
        return Field.builder().title(title).value(value).valueShortEnough(true).build();
    }

    private String buildScheduleLink(String scheduleId) {
        return slackProperties.getDashboardBaseUrl() + "/schedules/" + scheduleId;
    }

    private static String format(Instant instant) {
        return instant != null ? DATE_FORMATTER.format(instant) : "-";
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
