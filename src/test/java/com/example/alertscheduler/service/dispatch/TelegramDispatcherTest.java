package com.example.alertscheduler.service.dispatch;

import com.example.alertscheduler.client.DeliveryAttempt;
import com.example.alertscheduler.client.TelegramClient;
import com.example.alertscheduler.config.MetricsConfig;
import com.example.alertscheduler.config.TelegramProperties;
import com.example.alertscheduler.domain.enums.ParseMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TelegramDispatcher Tests")
class TelegramDispatcherTest {

    @Mock
    private TelegramClient telegramClient;

    @Mock
    private MetricsConfig metricsConfig;

    private List<Long> sleeps;
    private TelegramDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        var properties = new TelegramProperties();
        properties.setMaxRetries(3);
        properties.setRetryBaseDelayMs(500);

        sleeps = new ArrayList<>();
        dispatcher = new TelegramDispatcher(telegramClient, metricsConfig, properties, sleeps::add);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Nested
    @DisplayName("Retry policy")
    class RetryPolicyTests {

        @Test
        @DisplayName("Should retry a 500 response with exponential backoff until attempts are exhausted")
        void shouldRetryServerErrorUntilExhausted() {
            // Given
            when(telegramClient.sendMessage(anyString(), any())).thenReturn(DeliveryAttempt.httpFailure(500, "Internal Server Error"));

            // When
            var outcome = dispatcher.send("hello", ParseMode.HTML);

            // Then
            assertThat(outcome.isSent()).isFalse();
            assertThat(outcome.getDetail())
                    .startsWith("Telegram send failed after 3 attempts")
                    .contains("500");
            assertThat(sleeps).containsExactly(500L, 1000L);
            verify(telegramClient, times(3)).sendMessage("hello", ParseMode.HTML);
            verify(metricsConfig, times(2)).recordSendRetry();
            verify(metricsConfig).recordSendFailure();
            verify(metricsConfig, never()).recordSendSuccess();
        }

        @Test
        @DisplayName("Should not retry a 401 response")
        void shouldNotRetryUnauthorized() {
            // Given
            when(telegramClient.sendMessage(anyString(), any())).thenReturn(DeliveryAttempt.httpFailure(401, "Unauthorized"));

            // When
            var outcome = dispatcher.send("hello", ParseMode.HTML);

            // Then
            assertThat(outcome.isSent()).isFalse();
            assertThat(outcome.getDetail()).contains("401");
            assertThat(sleeps).isEmpty();
            verify(telegramClient, times(1)).sendMessage(anyString(), any());
            verify(metricsConfig, never()).recordSendRetry();
            verify(metricsConfig).recordSendFailure();
        }

        @Test
        @DisplayName("Should count one retry and one success when the second attempt succeeds")
        void shouldSucceedOnSecondAttempt() {
            // Given
            when(telegramClient.sendMessage(anyString(), any()))
                    .thenReturn(DeliveryAttempt.timeout(5000))
                    .thenReturn(DeliveryAttempt.success(200));

            // When
            var outcome = dispatcher.send("hello", ParseMode.MARKDOWN_V2);

            // Then
            assertThat(outcome.isSent()).isTrue();
            assertThat(outcome.getDetail()).isEqualTo("Telegram alert sent.");
            assertThat(sleeps).containsExactly(500L);
            verify(metricsConfig, times(1)).recordSendRetry();
            verify(metricsConfig, times(1)).recordSendSuccess();
            verify(metricsConfig, never()).recordSendFailure();
        }

        @Test
        @DisplayName("Should retry 429 and transport errors")
        void shouldRetryRateLimitAndTransportErrors() {
            // Given
            when(telegramClient.sendMessage(anyString(), any()))
                    .thenReturn(DeliveryAttempt.httpFailure(429, "Too Many Requests"))
                    .thenReturn(DeliveryAttempt.transportError(new java.net.ConnectException("Connection refused")))
                    .thenReturn(DeliveryAttempt.success(200));

            // When
            var outcome = dispatcher.send("hello", ParseMode.HTML);

            // Then
            assertThat(outcome.isSent()).isTrue();
            assertThat(sleeps).containsExactly(500L, 1000L);
            verify(telegramClient, times(3)).sendMessage(anyString(), any());
        }

        @Test
        @DisplayName("Should make a single attempt when maxRetries is 1")
        void shouldMakeSingleAttemptWithOneRetry() {
            // Given
            var properties = new TelegramProperties();
            properties.setMaxRetries(1);
            properties.setRetryBaseDelayMs(500);
            var singleShot = new TelegramDispatcher(telegramClient, metricsConfig, properties, sleeps::add);
            when(telegramClient.sendMessage(anyString(), any())).thenReturn(DeliveryAttempt.httpFailure(503, ""));

            // When
            var outcome = singleShot.send("hello", ParseMode.HTML);

            // Then
            assertThat(outcome.isSent()).isFalse();
            assertThat(outcome.getDetail()).startsWith("Telegram send failed after 1 attempts");
            assertThat(sleeps).isEmpty();
        }
    }

    @Nested
    @DisplayName("Interruption")
    class InterruptionTests {

        @Test
        @DisplayName("Should stop retrying and restore the interrupt flag when the backoff is interrupted")
        void shouldStopWhenInterrupted() {
            // Given
            var properties = new TelegramProperties();
            properties.setMaxRetries(3);
            properties.setRetryBaseDelayMs(500);
            var interrupting = new TelegramDispatcher(telegramClient, metricsConfig, properties, millis -> {
                throw new InterruptedException("shutdown");
            });
            when(telegramClient.sendMessage(anyString(), any())).thenReturn(DeliveryAttempt.httpFailure(502, "Bad Gateway"));

            // When
            var outcome = interrupting.send("hello", ParseMode.HTML);

            // Then
            assertThat(outcome.isSent()).isFalse();
            assertThat(outcome.getDetail()).startsWith("Telegram send interrupted after 1 attempt(s)");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(telegramClient, times(1)).sendMessage(anyString(), any());
            verify(metricsConfig).recordSendFailure();
        }
    }
}
