package com.driftwatch.domain;

import com.driftwatch.exception.UnsupportedTaskTypeException;

import java.util.Locale;

public enum TaskType {
    REGRESSION,
    CLASSIFICATION;

    public static TaskType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return REGRESSION;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new UnsupportedTaskTypeException(raw);
        }
    }
}
