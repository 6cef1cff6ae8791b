package com.factgate.core.validation;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.FieldType;
import com.factgate.core.model.Severity;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.WorkProduct;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ProvenanceValidator}.
 */
class ProvenanceValidatorTest {

    private ProvenanceValidator validator;
    private RuleConfig config;

    @BeforeEach
    void setUp() {
        validator = new ProvenanceValidator();
        config = RuleConfig.builder()
                .field(FieldDescriptor.builder().name("fee_amount").type(FieldType.NUMERIC).alias("fee").build())
                .field(FieldDescriptor.of("service_type", FieldType.ENUM))
                .field(FieldDescriptor.of("appointment_url", FieldType.URL))
                .nullableSourceTypes(Set.of(FieldType.ENUM))
                .requiredMetadataFields(List.of("model", "extraction_date"))
                .build();
    }

    @Test
    @DisplayName("Should report nothing for a fully sourced document")
    void shouldAcceptValidDocument() {
        List<ValidationFinding> findings = validate(validDocument());

        assertThat(findings).isEmpty();
    }

    @Test
    @DisplayName("Should report exactly one error when _metadata is missing")
    void shouldReportMissingMetadata() {
        Map<String, Object> doc = validDocument();
        doc.remove("_metadata");

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getRuleId()).isEqualTo(RuleIds.MISSING_METADATA);
        assertThat(findings.get(0).getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(findings.get(0).getField()).isEqualTo("_metadata");
    }

    @Test
    @DisplayName("Should reject a _metadata value that is not an object")
    void shouldReportInvalidMetadata() {
        Map<String, Object> doc = validDocument();
        doc.put("_metadata", "extracted yesterday");

        assertThat(validate(doc))
                .extracting(ValidationFinding::getRuleId)
                .containsExactly(RuleIds.INVALID_METADATA);
    }

    @Test
    @DisplayName("Should report missing and empty metadata fields separately")
    void shouldReportMetadataFields() {
        Map<String, Object> doc = validDocument();
        doc.put("_metadata", Map.of("model", " "));

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).extracting(ValidationFinding::getRuleId)
                .containsExactly(RuleIds.EMPTY_METADATA_FIELD, RuleIds.MISSING_METADATA_FIELD);
        assertThat(findings).extracting(ValidationFinding::getField)
                .containsExactly("_metadata.model", "_metadata.extraction_date");
    }

    @Test
    @DisplayName("Should report a missing verification date as an error")
    void shouldReportMissingVerifiedAt() {
        Map<String, Object> doc = validDocument();
        doc.remove("fee_amount_verified_at");

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getRuleId()).isEqualTo(RuleIds.MISSING_VERIFIED_AT);
        assertThat(findings.get(0).isError()).isTrue();
        assertThat(findings.get(0).getField()).isEqualTo("fee_amount");
        assertThat(findings.get(0).getMessage()).contains("fee_amount_verified_at");
    }

    @ParameterizedTest
    @ValueSource(strings = {"15/01/2025", "2025-1-15", "2025-01-15T10:00:00Z", "yesterday", ""})
    @DisplayName("Should reject verification dates not in YYYY-MM-DD form")
    void shouldReportInvalidDateFormat(String date) {
        Map<String, Object> doc = validDocument();
        doc.put("fee_amount_verified_at", date);

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getRuleId()).isEqualTo(RuleIds.INVALID_DATE_FORMAT);
        assertThat(findings.get(0).getField()).isEqualTo("fee_amount");
    }

    @Test
    @DisplayName("Should reject a verification date that is not a string")
    void shouldReportNonStringDate() {
        Map<String, Object> doc = validDocument();
        doc.put("fee_amount_verified_at", 20250115);

        assertThat(validate(doc))
                .extracting(ValidationFinding::getRuleId)
                .containsExactly(RuleIds.INVALID_DATE_FORMAT);
    }

    @Test
    @DisplayName("Missing source should use the configured severity")
    void shouldReportMissingSourceWithConfiguredSeverity() {
        Map<String, Object> doc = validDocument();
        doc.remove("fee_amount_source");

        List<ValidationFinding> warnings = validate(doc);
        List<ValidationFinding> errors = validator.validate(new ValidationContext(WorkProduct.of(doc), null,
                config.toBuilder().missingSourceSeverity(Severity.ERROR).build()));

        assertThat(warnings).hasSize(1);
        assertThat(warnings.get(0).getRuleId()).isEqualTo(RuleIds.MISSING_SOURCE);
        assertThat(warnings.get(0).getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(warnings.get(0).getMessage()).contains("missing source key");
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).getSeverity()).isEqualTo(Severity.ERROR);
    }

    @Test
    @DisplayName("Null or blank source should be reported as empty")
    void shouldReportEmptySource() {
        Map<String, Object> doc = validDocument();
        doc.put("fee_amount_source", "");
        doc.put("appointment_url", "https://example.gov/book");
        doc.put("appointment_url_source", null);
        doc.put("appointment_url_verified_at", "2025-01-15");

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).extracting(ValidationFinding::getField)
                .containsExactly("fee_amount", "appointment_url");
        assertThat(findings).allMatch(f -> f.getMessage().contains("requires non-empty source"));
    }

    @Test
    @DisplayName("Nullable sources should not be reported, but still need a date")
    void shouldSkipNullableSource() {
        Map<String, Object> doc = validDocument();
        doc.remove("service_type_source");
        doc.remove("service_type_verified_at");

        List<ValidationFinding> findings = validate(doc);

        assertThat(findings).extracting(ValidationFinding::getRuleId)
                .containsExactly(RuleIds.MISSING_VERIFIED_AT);
        assertThat(findings.get(0).getField()).isEqualTo("service_type");
    }

    @Test
    @DisplayName("Undeclared and absent fields should be ignored")
    void shouldIgnoreUndeclaredFields() {
        Map<String, Object> doc = validDocument();
        doc.put("office_count", 3);

        assertThat(validate(doc)).isEmpty();
    }

    @Test
    @DisplayName("Should not modify the document")
    void shouldNotMutateDocument() {
        Map<String, Object> doc = validDocument();
        doc.remove("fee_amount_source");
        Map<String, Object> snapshot = new HashMap<>(doc);

        validate(doc);

        assertThat(doc).isEqualTo(snapshot);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private List<ValidationFinding> validate(Map<String, Object> doc) {
        return validator.validate(new ValidationContext(WorkProduct.of(doc), null, config));
    }

    private static Map<String, Object> validDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("_metadata", Map.of("model", "extractor-large", "extraction_date", "2025-01-15"));
        doc.put("fee_amount", 25);
        doc.put("fee_amount_source", "https://example.gov/fees");
        doc.put("fee_amount_verified_at", "2025-01-15");
        doc.put("service_type", "passport_renewal");
        doc.put("service_type_source", null);
        doc.put("service_type_verified_at", "2025-01-15");
        return doc;
    }
}
