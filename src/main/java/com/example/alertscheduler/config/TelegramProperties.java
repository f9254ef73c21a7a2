package com.example.alertscheduler.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Telegram delivery configuration.
 * Validated once at boot; the dispatcher never re-reads it mid-flight.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "telegram")
public class TelegramProperties {

    /**
     * Bot API base URL
     */
    @NotBlank
    private String baseUrl = "https://api.telegram.org";

    @NotBlank
    private String botToken;

    /**
     * Destination chat for every alert
     */
    @NotBlank
    private String chatId;

    /**
     * Deadline of a single delivery attempt
     */
    @Min(100)
    private int requestTimeoutMs = 5000;

    /**
     * Total attempts per send, including the first one
     */
    @Min(1)
    @Max(10)
    private int maxRetries = 3;

    /**
     * Backoff base: attempt n waits retryBaseDelayMs * 2^(n-1) before attempt n+1
     */
    @Min(50)
    private long retryBaseDelayMs = 500;
}
