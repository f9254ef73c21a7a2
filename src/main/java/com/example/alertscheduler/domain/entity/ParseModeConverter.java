package com.example.alertscheduler.domain.entity;

import com.example.alertscheduler.domain.enums.ParseMode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ParseMode} by its Bot API code ("HTML", "MarkdownV2").
 */
@Converter(autoApply = true)
public class ParseModeConverter implements AttributeConverter<ParseMode, String> {

    @Override
    public String convertToDatabaseColumn(ParseMode attribute) {
        return attribute != null ? attribute.getCode() : null;
    }

    @Override
    public ParseMode convertToEntityAttribute(String dbData) {
        return dbData != null ? ParseMode.fromCode(dbData) : null;
    }
}
