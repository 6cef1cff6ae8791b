package com.factgate.core.config;

import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.FieldType;
import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.Severity;
import com.factgate.core.text.FactSentenceClassifiers;
import com.factgate.core.text.NumberExclusion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleConfig}.
 */
class RuleConfigTest {

    @Test
    @DisplayName("Defaults should match the documented thresholds and policies")
    void shouldProvideDefaults() {
        RuleConfig config = RuleConfig.defaults();

        assertThat(config.getMaxSentenceWords()).isEqualTo(22);
        assertThat(config.getMaxFactTokens()).isEqualTo(18);
        assertThat(config.getFactSentenceClassifier()).isSameAs(FactSentenceClassifiers.NUMERIC_OR_FIELD);
        assertThat(config.getMissingSourceSeverity()).isEqualTo(Severity.WARNING);
        assertThat(config.getRequiredMetadataFields())
                .containsExactly("extraction_date", "model", "extractor_version");
        assertThat(config.getNumberExclusions()).containsExactlyInAnyOrder(NumberExclusion.values());
        assertThat(config.getOverrides()).isEmpty();
    }

    @Test
    @DisplayName("Forbidden rules should be ordered verbs, terms, patterns")
    void shouldOrderForbiddenRules() {
        RuleConfig config = RuleConfig.builder()
                .forbiddenPatterns(List.of("in order to"))
                .forbiddenTerms(List.of("always"))
                .forbiddenVerbs(List.of("guarantee"))
                .build();

        assertThat(config.getForbiddenRules())
                .extracting(ForbiddenRule::getKind)
                .containsExactly(ForbiddenRule.Kind.VERB, ForbiddenRule.Kind.TERM, ForbiddenRule.Kind.PATTERN);
    }

    @Test
    @DisplayName("Allowed numbers should be stored in normalized form")
    void shouldNormalizeAllowedNumbers() {
        RuleConfig config = RuleConfig.builder()
                .allowedNumbers(List.of("1,000", "30.00", " 14 "))
                .build();

        assertThat(config.getAllowedNumbers()).containsExactly("1000", "30", "14");
    }

    @Test
    @DisplayName("Build should report every invalid value at once")
    void shouldAggregateValidationErrors() {
        RuleConfig.Builder builder = RuleConfig.builder()
                .maxSentenceWords(0)
                .maxFactTokens(-1)
                .forbiddenPatterns(List.of("["))
                .field(FieldDescriptor.of("fee_amount", FieldType.NUMERIC))
                .field(FieldDescriptor.of("fee_amount", FieldType.TEXT))
                .field(FieldDescriptor.of("_internal", FieldType.TEXT))
                .allowedNumbers(List.of("abc"));

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Rule configuration validation failed")
                .hasMessageContaining("'max_sentence_words' must be > 0")
                .hasMessageContaining("'max_fact_tokens' must be > 0")
                .hasMessageContaining("Invalid forbidden pattern '['")
                .hasMessageContaining("Duplicate field descriptor: 'fee_amount'")
                .hasMessageContaining("must not start with '_'")
                .hasMessageContaining("Allowed number is not a numeric literal: 'abc'");
    }

    @Test
    @DisplayName("withOverrides should replace overrides and keep everything else")
    void shouldReplaceOverrides() {
        OverrideRecord first = override("missing_source");
        OverrideRecord second = override("hallucinated_number");
        RuleConfig config = RuleConfig.builder()
                .maxSentenceWords(15)
                .override(first)
                .build();

        RuleConfig replaced = config.withOverrides(List.of(second));

        assertThat(replaced.getOverrides()).containsExactly(second);
        assertThat(replaced.getMaxSentenceWords()).isEqualTo(15);
        assertThat(config.getOverrides()).containsExactly(first);
    }

    @Test
    @DisplayName("Sources should be nullable by type or by field flag")
    void shouldResolveNullableSources() {
        FieldDescriptor serviceType = FieldDescriptor.of("service_type", FieldType.ENUM);
        FieldDescriptor openingHours = FieldDescriptor.builder()
                .name("opening_hours").type(FieldType.TEXT).sourceNullable(true).build();
        FieldDescriptor fee = FieldDescriptor.of("fee_amount", FieldType.NUMERIC);
        RuleConfig config = RuleConfig.builder()
                .nullableSourceTypes(Set.of(FieldType.ENUM))
                .fields(List.of(serviceType, openingHours, fee))
                .build();

        assertThat(config.isSourceNullable(serviceType)).isTrue();
        assertThat(config.isSourceNullable(openingHours)).isTrue();
        assertThat(config.isSourceNullable(fee)).isFalse();
    }

    private static OverrideRecord override(String rule) {
        return new OverrideRecord(rule, "fee_amount", "reviewed", "j.doe", LocalDate.of(2030, 1, 1), null);
    }
}
