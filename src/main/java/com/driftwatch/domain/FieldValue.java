package com.driftwatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * A single feature or prediction value: a number, a piece of text or nothing.
 * JSON numbers map to {@link Kind#NUMBER}, strings and booleans to {@link Kind#TEXT}.
 */
public final class FieldValue {

    public enum Kind { NUMBER, TEXT, NULL }

    private static final FieldValue MISSING = new FieldValue(Kind.NULL, Double.NaN, null);

    private final Kind kind;
    private final double number;
    private final String text;

    private FieldValue(Kind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    public static FieldValue of(double number) {
        return Double.isNaN(number) ? MISSING : new FieldValue(Kind.NUMBER, number, null);
    }

    public static FieldValue of(String text) {
        return text == null ? MISSING : new FieldValue(Kind.TEXT, Double.NaN, text);
    }

    public static FieldValue missing() {
        return MISSING;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldValue from(Object raw) {
        if (raw == null) {
            return MISSING;
        }
        if (raw instanceof Number) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof FieldValue) {
            return (FieldValue) raw;
        }
        return of(raw.toString());
    }

    @JsonValue
    public Object raw() {
        return switch (kind) {
            case NUMBER -> number;
            case TEXT -> text;
            case NULL -> null;
        };
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isMissing() {
        return kind == Kind.NULL;
    }

    public double asDouble() {
        return number;
    }

    /** Textual form used for class labels: numbers that are whole print without a fraction. */
    public String asLabel() {
        if (kind == Kind.TEXT) {
            return text;
        }
        if (kind == Kind.NUMBER && number == Math.rint(number) && !Double.isInfinite(number)) {
            return Long.toString((long) number);
        }
        return kind == Kind.NUMBER ? Double.toString(number) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue other = (FieldValue) o;
        return kind == other.kind
            && Double.compare(number, other.number) == 0
            && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text);
    }

    @Override
    public String toString() {
        return String.valueOf(raw());
    }
}
