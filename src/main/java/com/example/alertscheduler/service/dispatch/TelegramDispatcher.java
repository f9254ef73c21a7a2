package com.example.alertscheduler.service.dispatch;

import com.example.alertscheduler.client.DeliveryAttempt;
import com.example.alertscheduler.client.TelegramClient;
import com.example.alertscheduler.config.MetricsConfig;
import com.example.alertscheduler.config.TelegramProperties;
import com.example.alertscheduler.domain.enums.ParseMode;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Delivers one message to Telegram under a fixed retry policy.
 * <p>
 * For attempt 1..maxRetries:
 * - success returns immediately
 * - a fatal failure (4xx other than 408/425/429) returns immediately, no backoff
 * - a retryable failure sleeps retryBaseDelayMs * 2^(attempt-1) and tries again
 * <p>
 * Never throws for delivery failures. Exactly one success or failure counter
 * increment per send, one retry increment per retried attempt.
 */
@Slf4j
@Service
public class TelegramDispatcher {

    /**
     * Blocking pause between attempts, replaceable in tests
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final TelegramClient telegramClient;
    private final MetricsConfig metricsConfig;
    private final int maxRetries;
    private final IntervalFunction backoff;
    private final Sleeper sleeper;

    @Autowired
    public TelegramDispatcher(TelegramClient telegramClient, MetricsConfig metricsConfig, TelegramProperties properties) {
        this(telegramClient, metricsConfig, properties, Thread::sleep);
    }

    public TelegramDispatcher(TelegramClient telegramClient, MetricsConfig metricsConfig, TelegramProperties properties, Sleeper sleeper) {
        this.telegramClient = telegramClient;
        this.metricsConfig = metricsConfig;
        this.maxRetries = properties.getMaxRetries();
        this.backoff = IntervalFunction.ofExponentialBackoff(properties.getRetryBaseDelayMs(), 2.0);
        this.sleeper = sleeper;
    }

    /**
     * Send a message with retries.
     *
     * @param message   message body
     * @param parseMode markup dialect of the body
     * @return sent=true on the first successful attempt, sent=false otherwise
     */
    public DispatchOutcome send(String message, ParseMode parseMode) {
        DeliveryAttempt last = null;

        for (var attempt = 1; attempt <= maxRetries; attempt++) {
            last = telegramClient.sendMessage(message, parseMode);

            if (last.isSuccess()) {
                log.info("Telegram alert sent on attempt {}/{}", attempt, maxRetries);
                metricsConfig.recordSendSuccess();
                return DispatchOutcome.sent(last.getDetail());
            }

            if (!last.isRetryable()) {
                log.error("Telegram send failed with non-retryable error: {}", last.getDetail());
                metricsConfig.recordSendFailure();
                return DispatchOutcome.failed(last.getDetail());
            }

            if (attempt == maxRetries) {
                break;
            }

            var delayMs = backoff.apply(attempt);
            log.warn("Telegram attempt {}/{} failed ({}), retrying in {}ms", attempt, maxRetries, last.getDetail(), delayMs);
            metricsConfig.recordSendRetry();

            try {
                sleeper.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Telegram retry backoff interrupted after attempt {}", attempt);
                metricsConfig.recordSendFailure();
                return DispatchOutcome.failed("Telegram send interrupted after " + attempt + " attempt(s): " + last.getDetail());
            }
        }

        var detail = String.format("Telegram send failed after %d attempts: %s", maxRetries, last.getDetail());
        log.error(detail);
        metricsConfig.recordSendFailure();
        return DispatchOutcome.failed(detail);
    }
}
