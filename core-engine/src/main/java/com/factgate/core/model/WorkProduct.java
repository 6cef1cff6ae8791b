package com.factgate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of a work product document.
 *
 * <p>
 * A work product is a JSON object holding a reserved {@value #METADATA_KEY}
 * block and any number of factual field triples {@code X},
 * {@code X_source}, {@code X_verified_at}. The document is kept as a free-form
 * {@link Map}; validators query fields by name without a fixed schema.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable at the top level and never mutated by the engine,
 * so they may be shared across threads. Nested values are exposed as parsed.
 * </p>
 *
 * @since 1.0.0
 */
public final class WorkProduct {

    /** Reserved key for extraction metadata. */
    public static final String METADATA_KEY = "_metadata";

    /** Suffix of the per-field source key. */
    public static final String SOURCE_SUFFIX = "_source";

    /** Suffix of the per-field verification date key. */
    public static final String VERIFIED_AT_SUFFIX = "_verified_at";

    private final Map<String, Object> fields;

    private WorkProduct(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Wrap an already-parsed document.
     *
     * @param document parsed JSON value; must be a {@link Map} with string keys
     * @return the work product
     * @throws MalformedDocumentException if {@code document} is {@code null}
     *                                    or not a mapping
     */
    public static WorkProduct of(Object document) {
        if (!(document instanceof Map<?, ?> map)) {
            throw new MalformedDocumentException(
                    "Work product must be a JSON object, got: "
                            + (document == null ? "null" : document.getClass().getSimpleName()));
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new MalformedDocumentException(
                        "Work product keys must be strings, got: " + entry.getKey());
            }
            copy.put(key, entry.getValue());
        }
        return new WorkProduct(copy);
    }

    /**
     * @return an empty work product (no metadata, no fields)
     */
    public static WorkProduct empty() {
        return new WorkProduct(Map.of());
    }

    // ---------------------------------------------------------------
    // Field accessors
    // ---------------------------------------------------------------

    /**
     * @param key the JSON key
     * @return {@code true} if the key is present, even with a {@code null} value
     */
    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * @param key the JSON key
     * @return the value, or empty if absent or {@code null}
     */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    /**
     * @return the {@value #METADATA_KEY} value, or empty if absent or {@code null}
     */
    public Optional<Object> metadata() {
        return get(METADATA_KEY);
    }

    /**
     * @param fieldName factual field name {@code X}
     * @return the {@code X_source} value, or empty if absent or {@code null}
     */
    public Optional<Object> sourceOf(String fieldName) {
        return get(fieldName + SOURCE_SUFFIX);
    }

    /**
     * @param fieldName factual field name {@code X}
     * @return the {@code X_verified_at} value, or empty if absent or {@code null}
     */
    public Optional<Object> verifiedAtOf(String fieldName) {
        return get(fieldName + VERIFIED_AT_SUFFIX);
    }

    /**
     * @return unmodifiable, insertion-ordered view of every top-level entry
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkProduct that))
            return false;
        return Objects.equals(fields, that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "WorkProduct" + fields;
    }
}
