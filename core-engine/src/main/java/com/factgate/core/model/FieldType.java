package com.factgate.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic type of a declared factual field.
 *
 * @since 1.0.0
 */
public enum FieldType {

    NUMERIC,
    TEXT,
    URL,
    ENUM;

    /**
     * @param value configuration value such as {@code numeric}
     * @return the matching type
     * @throws IllegalArgumentException if the value is not a known type
     */
    public static FieldType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Field type must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown field type: '" + value
                    + "'. Supported: numeric, text, url, enum", e);
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
