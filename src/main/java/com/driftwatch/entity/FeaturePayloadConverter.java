package com.driftwatch.entity;

import com.driftwatch.domain.FieldValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/** Stores a feature row as a JSON object; JSON nulls read back as missing values. */
@Converter
public class FeaturePayloadConverter implements AttributeConverter<Map<String, FieldValue>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_MAP = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(Map<String, FieldValue> attribute) {
        if (attribute == null) {
            return null;
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        attribute.forEach((k, v) -> raw.put(k, v == null ? null : v.raw()));
        try {
            return MAPPER.writeValueAsString(raw);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Feature row could not be serialized", ex);
        }
    }

    @Override
    public Map<String, FieldValue> convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            Map<String, Object> raw = MAPPER.readValue(dbData, RAW_MAP);
            Map<String, FieldValue> values = new LinkedHashMap<>();
            raw.forEach((k, v) -> values.put(k, FieldValue.from(v)));
            return values;
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored feature row is not valid JSON", ex);
        }
    }
}
