package io.github.chirino.access.persistence.entity;

import io.github.chirino.access.model.AccessLevel;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AccessLevelConverter implements AttributeConverter<AccessLevel, String> {

    @Override
    public String convertToDatabaseColumn(AccessLevel attribute) {
        return attribute == null ? null : attribute.toValue();
    }

    @Override
    public AccessLevel convertToEntityAttribute(String dbData) {
        // unknown names load as null and the row is skipped by the store
        return AccessLevel.fromValue(dbData).orElse(null);
    }
}
