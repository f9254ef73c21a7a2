package com.example.alertscheduler.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Markup dialect Telegram uses to render a message body.
 * The code is the exact value of the Bot API {@code parse_mode} field.
 */
@Getter
@RequiredArgsConstructor
public enum ParseMode {

    HTML("HTML"),

    MARKDOWN_V2("MarkdownV2");

    @JsonValue
    private final String code;

    /**
     * Find ParseMode by its Bot API code
     */
    @JsonCreator
    public static ParseMode fromCode(String code) {
        for (var mode : values()) {
            if (mode.getCode().equals(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown parse mode: " + code + " (allowed: HTML, MarkdownV2)");
    }
}
