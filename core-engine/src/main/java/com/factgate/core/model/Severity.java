package com.factgate.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a {@link ValidationFinding}.
 *
 * <p>
 * Only {@link #ERROR} findings block publishing; warnings are advisory.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    ERROR,
    WARNING;

    /**
     * Parse a configuration value ({@code error} / {@code warning}),
     * case-insensitively.
     *
     * @param value the configured value
     * @return the matching severity
     * @throws IllegalArgumentException if the value is not a known severity
     */
    public static Severity fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error" -> ERROR;
            case "warning" -> WARNING;
            default -> throw new IllegalArgumentException(
                    "Unknown severity: '" + value + "'. Supported: error, warning");
        };
    }

    /**
     * @return the lowercase configuration / report form
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
