package com.example.alertscheduler.client;

import com.example.alertscheduler.client.TelegramModels.SendMessageRequest;
import com.example.alertscheduler.config.TelegramProperties;
import com.example.alertscheduler.domain.enums.ParseMode;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Client for the Telegram Bot API {@code sendMessage} method.
 * <p>
 * Performs exactly one attempt per call under a hard deadline and never
 * throws for delivery failures: every outcome comes back as a
 * {@link DeliveryAttempt}. Retrying is the dispatcher's job.
 */
@Slf4j
@Component
public class TelegramClient {

    private final WebClient webClient;
    private final TelegramProperties properties;

    public TelegramClient(@Qualifier("telegramWebClient") WebClient webClient, TelegramProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Deliver a text message to the configured chat.
     *
     * @param text      message body
     * @param parseMode markup dialect of the body
     * @return the classified result of this single attempt
     */
    public DeliveryAttempt sendMessage(String text, ParseMode parseMode) {
        var request = SendMessageRequest.builder()
                .chatId(properties.getChatId())
                .text(text)
                .parseMode(parseMode.getCode())
                .build();
        var timeoutMs = properties.getRequestTimeoutMs();

        try {
            var attempt = webClient.post()
                    // concatenated, not templated: the token's ':' must not be percent-encoded
                    .uri("/bot" + properties.getBotToken() + "/sendMessage")
                    .bodyValue(request)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> classifyResponse(response.statusCode().value(), body)))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .onErrorResume(e -> Mono.just(classifyError(e, timeoutMs)))
                    .block();

            return attempt != null ? attempt : DeliveryAttempt.transportError(new IllegalStateException("Empty response"));
        } catch (RuntimeException e) {
            var cause = Exceptions.unwrap(e);
            log.error("Unexpected error calling Telegram: {}", cause.getMessage(), cause);
            return classifyError(cause, timeoutMs);
        }
    }

    private DeliveryAttempt classifyResponse(int statusCode, String body) {
        if (statusCode >= 200 && statusCode < 300) {
            return DeliveryAttempt.success(statusCode);
        }
        return DeliveryAttempt.httpFailure(statusCode, body);
    }

    private DeliveryAttempt classifyError(Throwable error, long timeoutMs) {
        if (error instanceof TimeoutException || isReadTimeout(error)) {
            return DeliveryAttempt.timeout(timeoutMs);
        }
        if (error instanceof WebClientRequestException requestException) {
            var cause = requestException.getMostSpecificCause();
            return DeliveryAttempt.transportError(cause != null ? cause : requestException);
        }
        return DeliveryAttempt.transportError(error);
    }

    private boolean isReadTimeout(Throwable error) {
        var current = error;
        while (current != null) {
            if (current instanceof ReadTimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
