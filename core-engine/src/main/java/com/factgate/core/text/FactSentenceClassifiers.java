package com.factgate.core.text;

import java.util.Locale;
import java.util.Objects;

/**
 * Built-in {@link FactSentenceClassifier} strategies and the name lookup used
 * by the configuration loader.
 *
 * @since 1.0.0
 */
public final class FactSentenceClassifiers {

    /** Configuration name of {@link #NUMERIC_OR_FIELD}. */
    public static final String NUMERIC_OR_FIELD_NAME = "numeric_or_field";

    /** Configuration name of {@link #NUMERIC_ONLY}. */
    public static final String NUMERIC_ONLY_NAME = "numeric_only";

    /** A sentence with a numeric token or a mention of a declared field. */
    public static final FactSentenceClassifier NUMERIC_OR_FIELD = (sentence, words, mentionedFields) ->
            !mentionedFields.isEmpty() || WordTokenizer.containsNumericToken(words);

    /** A sentence with a numeric token. */
    public static final FactSentenceClassifier NUMERIC_ONLY = (sentence, words, mentionedFields) ->
            WordTokenizer.containsNumericToken(words);

    private FactSentenceClassifiers() {
        // utility class — not instantiable
    }

    /**
     * Look up a built-in classifier by configuration name.
     *
     * @param name {@value #NUMERIC_OR_FIELD_NAME} or {@value #NUMERIC_ONLY_NAME}
     * @return the classifier
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FactSentenceClassifier named(String name) {
        Objects.requireNonNull(name, "Classifier name must not be null");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case NUMERIC_OR_FIELD_NAME -> NUMERIC_OR_FIELD;
            case NUMERIC_ONLY_NAME -> NUMERIC_ONLY;
            default -> throw new IllegalArgumentException(
                    "Unknown fact sentence classifier: '" + name
                            + "'. Supported: " + NUMERIC_OR_FIELD_NAME + ", " + NUMERIC_ONLY_NAME);
        };
    }
}
