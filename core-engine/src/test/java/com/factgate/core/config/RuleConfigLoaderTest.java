package com.factgate.core.config;

import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.FieldType;
import com.factgate.core.model.Severity;
import com.factgate.core.text.FactSentenceClassifiers;
import com.factgate.core.text.NumberExclusion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleConfigLoader}.
 */
class RuleConfigLoaderTest {

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RuleConfig config = RuleConfigLoader.fromClasspath("test-rules.yml");

        assertThat(config.getMaxSentenceWords()).isEqualTo(12);
        assertThat(config.getMaxFactTokens()).isEqualTo(8);
        assertThat(config.getFactSentenceClassifier()).isSameAs(FactSentenceClassifiers.NUMERIC_ONLY);
        assertThat(config.getForbiddenRules())
                .extracting(ForbiddenRule::identity)
                .containsExactly("verb:guarantee", "term:always", "term:guaranteed", "pattern:in order to");
        assertThat(config.getMissingSourceSeverity()).isEqualTo(Severity.ERROR);
        assertThat(config.getNullableSourceTypes()).containsExactly(FieldType.ENUM);
        assertThat(config.getRequiredMetadataFields()).containsExactly("model");
    }

    @Test
    @DisplayName("Should bind field declarations with aliases and nullable sources")
    void shouldBindFields() {
        RuleConfig config = RuleConfigLoader.fromClasspath("test-rules.yml");

        assertThat(config.getFieldDescriptors())
                .extracting(FieldDescriptor::getName)
                .containsExactly("fee_amount", "service_type", "office_hours");

        FieldDescriptor fee = config.getFieldDescriptors().get(0);
        assertThat(fee.getType()).isEqualTo(FieldType.NUMERIC);
        assertThat(fee.getAliases()).containsExactly("fee_amount", "fee amount", "fee");

        FieldDescriptor hours = config.getFieldDescriptors().get(2);
        assertThat(hours.isSourceNullable()).isTrue();
        assertThat(config.isSourceNullable(hours)).isTrue();
        assertThat(config.isSourceNullable(config.getFieldDescriptors().get(1))).isTrue();
        assertThat(config.isSourceNullable(fee)).isFalse();
    }

    @Test
    @DisplayName("Should bind number grounding and overrides")
    void shouldBindNumberGroundingAndOverrides() {
        RuleConfig config = RuleConfigLoader.fromClasspath("test-rules.yml");

        assertThat(config.getAllowedNumbers()).containsExactlyInAnyOrder("112", "14");
        assertThat(config.getNumberExclusions())
                .containsExactlyInAnyOrder(NumberExclusion.ISO_DATE, NumberExclusion.YEAR);
        assertThat(config.getOverrides()).hasSize(1);
        assertThat(config.getOverrides().get(0).getRuleId()).isEqualTo("missing_source");
        assertThat(config.getOverrides().get(0).getExpiresAt()).isEqualTo(LocalDate.of(2030, 1, 1));
        assertThat(config.getOverrides().get(0).getApprovedBy()).isEqualTo("j.doe");
    }

    @Test
    @DisplayName("Should load the bundled default rules")
    void shouldLoadBundledDefaults() {
        RuleConfig config = RuleConfigLoader.fromClasspath(RuleConfigLoader.DEFAULT_RESOURCE);

        assertThat(config.getMaxSentenceWords()).isEqualTo(RuleConfig.DEFAULT_MAX_SENTENCE_WORDS);
        assertThat(config.getMaxFactTokens()).isEqualTo(RuleConfig.DEFAULT_MAX_FACT_TOKENS);
        assertThat(config.getForbiddenVerbs()).contains("guarantee");
        assertThat(config.getForbiddenTerms()).contains("always");
        assertThat(config.getFieldDescriptors()).extracting(FieldDescriptor::getName).contains("fee_amount");
        assertThat(config.getNumberExclusions()).containsExactlyInAnyOrderElementsOf(NumberExclusion.defaults());
        assertThat(config.getOverrides()).isEmpty();
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RuleConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String path = dir.resolve("absent.yml").toString();

        assertThatThrownBy(() -> RuleConfigLoader.fromFile(path))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should load from a file system path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("rules.yml");
        Files.writeString(file, "thresholds:\n  max_sentence_words: 30\n");

        RuleConfig config = RuleConfigLoader.fromFile(file.toString());

        assertThat(config.getMaxSentenceWords()).isEqualTo(30);
        assertThat(config.getMaxFactTokens()).isEqualTo(RuleConfig.DEFAULT_MAX_FACT_TOKENS);
    }

    @Test
    @DisplayName("Should use defaults for an empty document")
    void shouldUseDefaultsForEmptyYaml() {
        RuleConfig config = RuleConfigLoader.fromYaml("");

        assertThat(config.getMaxSentenceWords()).isEqualTo(RuleConfig.DEFAULT_MAX_SENTENCE_WORDS);
        assertThat(config.getForbiddenRules()).isEmpty();
        assertThat(config.getRequiredMetadataFields())
                .containsExactlyElementsOf(RuleConfig.DEFAULT_REQUIRED_METADATA_FIELDS);
    }

    @Test
    @DisplayName("Should report every binding error at once")
    void shouldAggregateBindingErrors() {
        String yaml = String.join("\n",
                "thresholds:",
                "  max_sentence_words: many",
                "field_policy:",
                "  missing_source_severity: fatal",
                "fields:",
                "  - name: fee_amount",
                "number_grounding:",
                "  exclusions: [roman_numeral]");

        assertThatThrownBy(() -> RuleConfigLoader.fromYaml(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("thresholds.max_sentence_words")
                .hasMessageContaining("Unknown severity: 'fatal'")
                .hasMessageContaining("fields[0].type is required")
                .hasMessageContaining("roman_numeral");
    }

    @Test
    @DisplayName("Should reject an invalid forbidden pattern")
    void shouldRejectInvalidPattern() {
        String yaml = "lexicon_rules:\n  forbidden_patterns: [\"(unclosed\"]\n";

        assertThatThrownBy(() -> RuleConfigLoader.fromYaml(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid forbidden pattern '(unclosed'");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys() {
        String yaml = "thresholds:\n  max_sentence_words: 10\n  max_sentence_words: 12\n";

        assertThatThrownBy(() -> RuleConfigLoader.fromYaml(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid YAML");
    }

    @Test
    @DisplayName("Should reject an override without approver")
    void shouldRejectIncompleteOverride() {
        String yaml = String.join("\n",
                "overrides:",
                "  - rule: missing_source",
                "    field: fee_amount",
                "    reason: pending",
                "    expires_at: 2030-01-01");

        assertThatThrownBy(() -> RuleConfigLoader.fromYaml(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'approved_by'");
    }

    @Test
    @DisplayName("Should accept quoted expiry dates")
    void shouldAcceptQuotedExpiryDate() {
        String yaml = String.join("\n",
                "overrides:",
                "  - rule: missing_source",
                "    field: fee_amount",
                "    reason: pending",
                "    approved_by: j.doe",
                "    expires_at: \"2030-06-15\"");

        RuleConfig config = RuleConfigLoader.fromYaml(yaml);

        assertThat(config.getOverrides().get(0).getExpiresAt()).isEqualTo(LocalDate.of(2030, 6, 15));
    }
}
