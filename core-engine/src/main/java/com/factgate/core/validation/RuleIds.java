package com.factgate.core.validation;

/**
 * Rule identifiers carried by findings and matched by overrides.
 *
 * @since 1.0.0
 */
public final class RuleIds {

    // Provenance
    public static final String MISSING_METADATA = "missing_metadata";
    public static final String INVALID_METADATA = "invalid_metadata";
    public static final String MISSING_METADATA_FIELD = "missing_metadata_field";
    public static final String EMPTY_METADATA_FIELD = "empty_metadata_field";
    public static final String MISSING_VERIFIED_AT = "missing_verified_at";
    public static final String INVALID_DATE_FORMAT = "invalid_date_format";
    public static final String MISSING_SOURCE = "missing_source";

    // Lexicon
    public static final String FORBIDDEN_LANGUAGE = "forbidden_language";
    public static final String SENTENCE_TOO_LONG = "sentence_too_long";
    public static final String FACT_SENTENCE_TOO_LONG = "fact_sentence_too_long";

    // Number grounding
    public static final String HALLUCINATED_NUMBER = "hallucinated_number";

    private RuleIds() {
        // constants only
    }
}
