package com.driftwatch.entity;

import com.driftwatch.domain.FieldValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class FieldValueConverter implements AttributeConverter<FieldValue, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(FieldValue attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? null : attribute.raw());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Prediction value could not be serialized", ex);
        }
    }

    @Override
    public FieldValue convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return FieldValue.missing();
        }
        try {
            return FieldValue.from(MAPPER.readValue(dbData, Object.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored prediction value is not valid JSON", ex);
        }
    }
}
