package com.example.alertscheduler.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient configuration for the Telegram Bot API.
 * <p>
 * Connect and response timeouts follow the per-attempt deadline; the
 * client enforces the same deadline again on the whole exchange.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    private static final String SERVICE_NAME = "Telegram";

    @Bean(name = "telegramWebClient")
    public WebClient telegramWebClient(WebClient.Builder builder, TelegramProperties properties) {
        return createWebClient(builder, properties.getBaseUrl(), properties.getRequestTimeoutMs());
    }

    static WebClient createWebClient(WebClient.Builder builder, String baseUrl, int timeoutMs) {
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
                .responseTimeout(Duration.ofMillis(timeoutMs));

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Log outgoing requests. The path carries the bot token, so only the host is logged.
     */
    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[{}] Request: {} {}", SERVICE_NAME, clientRequest.method(), clientRequest.url().getHost());
            return Mono.just(clientRequest);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[{}] Error response: {}", SERVICE_NAME, clientResponse.statusCode());
            } else {
                log.debug("[{}] Response status: {}", SERVICE_NAME, clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
