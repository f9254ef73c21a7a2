package com.example.alertscheduler.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTOs for the Telegram Bot API
 */
public class TelegramModels {
    private TelegramModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SendMessageRequest {
        @JsonProperty("chat_id")
        private String chatId;
        private String text;
        @JsonProperty("parse_mode")
        private String parseMode;
    }
}
