package com.factgate.core.json;

import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportJson}.
 */
class ReportJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should serialize findings with snake_case keys and omit missing locations")
    void shouldSerializeReport() throws Exception {
        ValidationFinding provenance = ValidationFinding.builder()
                .error().ruleId("missing_source").validator("provenance").field("fee_amount")
                .message("Field 'fee_amount' missing source key (fee_amount_source)").build();
        ValidationFinding lexicon = ValidationFinding.builder()
                .warning().ruleId("sentence_too_long").validator("lexicon").offset(12).span("Long one.")
                .message("Sentence too long").build();
        OverrideRecord override = new OverrideRecord("missing_source", "fee_amount", "pending", "j.doe",
                LocalDate.of(2030, 1, 1), null);
        ValidationReport report = new ValidationReport(List.of(provenance), List.of(lexicon),
                List.of(new ValidationReport.Suppression(provenance, override)));

        JsonNode json = mapper.readTree(ReportJson.toJson(report));

        assertThat(json.get("passed").asBoolean()).isTrue();
        JsonNode error = json.get("errors").get(0);
        assertThat(error.get("severity").asText()).isEqualTo("error");
        assertThat(error.get("rule_id").asText()).isEqualTo("missing_source");
        assertThat(error.get("field").asText()).isEqualTo("fee_amount");
        assertThat(error.has("offset")).isFalse();
        assertThat(json.get("warnings").get(0).get("offset").asInt()).isEqualTo(12);
        JsonNode suppressed = json.get("suppressed_errors").get(0).get("override");
        assertThat(suppressed.get("type").asText()).isEqualTo("override");
        assertThat(suppressed.get("expires_at").asText()).isEqualTo("2030-01-01");
        assertThat(suppressed.get("approved_by").asText()).isEqualTo("j.doe");
    }

    @Test
    @DisplayName("Serialized overrides should load back")
    void shouldRoundTripOverrides() throws Exception {
        OverrideRecord override = new OverrideRecord("hallucinated_number", "fee_amount", "confirmed", "a.editor",
                LocalDate.of(2025, 12, 31), null);
        ValidationFinding error = ValidationFinding.builder()
                .error().ruleId("hallucinated_number").field("fee_amount").offset(3).message("m").build();
        ValidationReport report = new ValidationReport(List.of(error), List.of(),
                List.of(new ValidationReport.Suppression(error, override)));

        JsonNode node = mapper.readTree(ReportJson.toJson(report)).get("suppressed_errors").get(0).get("override");

        assertThat(OverrideLoader.fromString("[" + node + "]")).containsExactly(override);
    }
}
