package com.factgate.core.json;

import com.factgate.core.model.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serializes {@link ValidationReport}s to JSON.
 *
 * <p>
 * Output is deterministic: property order is fixed on the model classes and
 * dates are ISO strings, so validating the same inputs twice gives
 * byte-identical JSON.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReportJson {

    private ReportJson() {
        // utility class — not instantiable
    }

    /**
     * @param report the report; must not be {@code null}
     * @return pretty-printed JSON
     */
    public static String toJson(ValidationReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return JsonMappers.mapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation report: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param report the report; must not be {@code null}
     * @return UTF-8 encoded JSON
     */
    public static byte[] toBytes(ValidationReport report) {
        return toJson(report).getBytes(StandardCharsets.UTF_8);
    }
}
