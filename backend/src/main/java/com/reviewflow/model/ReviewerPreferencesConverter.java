package com.reviewflow.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ReviewerPreferencesConverter implements AttributeConverter<ReviewerPreferences, String> {

    @Override
    public String convertToDatabaseColumn(ReviewerPreferences attribute) {
        return ReviewerPreferencesJsonCodec.toJson(attribute);
    }

    @Override
    public ReviewerPreferences convertToEntityAttribute(String dbData) {
        return ReviewerPreferencesJsonCodec.fromJson(dbData);
    }
}
