package com.factgate.core.config;

import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.FieldType;
import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.Severity;
import com.factgate.core.text.FactSentenceClassifier;
import com.factgate.core.text.FactSentenceClassifiers;
import com.factgate.core.text.FieldMentions;
import com.factgate.core.text.NumberExclusion;
import com.factgate.core.text.NumberNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable rule configuration shared by every validator.
 *
 * <p>
 * A {@code RuleConfig} is built once (through the {@link Builder} or
 * {@link RuleConfigLoader}) and passed explicitly to each validation call.
 * All regular expressions (forbidden verbs, terms and patterns, field alias
 * patterns) are compiled once at build time and cached on the instance, so
 * the configuration can be shared freely across concurrent validations.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * {@link Builder#build()} checks every value and reports all problems
 * together in one {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfig {

    public static final int DEFAULT_MAX_SENTENCE_WORDS = 22;
    public static final int DEFAULT_MAX_FACT_TOKENS = 18;
    public static final List<String> DEFAULT_REQUIRED_METADATA_FIELDS =
            List.of("extraction_date", "model", "extractor_version");

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------
    private final int maxSentenceWords;
    private final int maxFactTokens;
    private final FactSentenceClassifier factSentenceClassifier;

    // ---------------------------------------------------------------
    // Lexicon
    // ---------------------------------------------------------------
    private final List<String> forbiddenVerbs;
    private final List<String> forbiddenPatterns;
    private final List<String> forbiddenTerms;
    private final List<ForbiddenRule> forbiddenRules;

    // ---------------------------------------------------------------
    // Field policy
    // ---------------------------------------------------------------
    private final Severity missingSourceSeverity;
    private final Set<FieldType> nullableSourceTypes;
    private final List<String> requiredMetadataFields;
    private final List<FieldDescriptor> fieldDescriptors;
    private final FieldMentions fieldMentions;

    // ---------------------------------------------------------------
    // Number grounding
    // ---------------------------------------------------------------
    private final Set<String> allowedNumbers;
    private final Set<NumberExclusion> numberExclusions;

    // ---------------------------------------------------------------
    // Overrides
    // ---------------------------------------------------------------
    private final List<OverrideRecord> overrides;

    private RuleConfig(Builder b, List<ForbiddenRule> forbiddenRules, Set<String> allowedNumbers) {
        this.maxSentenceWords = b.maxSentenceWords;
        this.maxFactTokens = b.maxFactTokens;
        this.factSentenceClassifier = b.factSentenceClassifier;
        this.forbiddenVerbs = List.copyOf(b.forbiddenVerbs);
        this.forbiddenPatterns = List.copyOf(b.forbiddenPatterns);
        this.forbiddenTerms = List.copyOf(b.forbiddenTerms);
        this.forbiddenRules = Collections.unmodifiableList(forbiddenRules);
        this.missingSourceSeverity = b.missingSourceSeverity;
        this.nullableSourceTypes = Collections.unmodifiableSet(
                b.nullableSourceTypes.isEmpty() ? EnumSet.noneOf(FieldType.class) : EnumSet.copyOf(b.nullableSourceTypes));
        this.requiredMetadataFields = List.copyOf(b.requiredMetadataFields);
        this.fieldDescriptors = List.copyOf(b.fieldDescriptors);
        this.fieldMentions = new FieldMentions(fieldDescriptors);
        this.allowedNumbers = Collections.unmodifiableSet(allowedNumbers);
        this.numberExclusions = Collections.unmodifiableSet(
                b.numberExclusions.isEmpty() ? EnumSet.noneOf(NumberExclusion.class) : EnumSet.copyOf(b.numberExclusions));
        this.overrides = List.copyOf(b.overrides);
    }

    /**
     * @return a configuration with every default and no rules, fields or
     *         overrides
     */
    public static RuleConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration's values
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxSentenceWords = maxSentenceWords;
        b.maxFactTokens = maxFactTokens;
        b.factSentenceClassifier = factSentenceClassifier;
        b.forbiddenVerbs.addAll(forbiddenVerbs);
        b.forbiddenPatterns.addAll(forbiddenPatterns);
        b.forbiddenTerms.addAll(forbiddenTerms);
        b.missingSourceSeverity = missingSourceSeverity;
        b.nullableSourceTypes.addAll(nullableSourceTypes);
        b.requiredMetadataFields.clear();
        b.requiredMetadataFields.addAll(requiredMetadataFields);
        b.fieldDescriptors.addAll(fieldDescriptors);
        b.allowedNumbers.addAll(allowedNumbers);
        b.numberExclusions.clear();
        b.numberExclusions.addAll(numberExclusions);
        b.overrides.addAll(overrides);
        return b;
    }

    /**
     * @param overrides override records for this run
     * @return a copy of this configuration with {@code overrides} replacing
     *         the current list
     */
    public RuleConfig withOverrides(List<OverrideRecord> overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        Builder b = toBuilder();
        b.overrides.clear();
        b.overrides.addAll(overrides);
        return b.build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuleConfig}. Every property has a default;
     * {@link #build()} validates the result.
     */
    public static final class Builder {
        private int maxSentenceWords = DEFAULT_MAX_SENTENCE_WORDS;
        private int maxFactTokens = DEFAULT_MAX_FACT_TOKENS;
        private FactSentenceClassifier factSentenceClassifier = FactSentenceClassifiers.NUMERIC_OR_FIELD;
        private final List<String> forbiddenVerbs = new ArrayList<>();
        private final List<String> forbiddenPatterns = new ArrayList<>();
        private final List<String> forbiddenTerms = new ArrayList<>();
        private Severity missingSourceSeverity = Severity.WARNING;
        private final Set<FieldType> nullableSourceTypes = new LinkedHashSet<>();
        private final List<String> requiredMetadataFields = new ArrayList<>(DEFAULT_REQUIRED_METADATA_FIELDS);
        private final List<FieldDescriptor> fieldDescriptors = new ArrayList<>();
        private final List<String> allowedNumbers = new ArrayList<>();
        private final Set<NumberExclusion> numberExclusions = new LinkedHashSet<>(NumberExclusion.defaults());
        private final List<OverrideRecord> overrides = new ArrayList<>();

        private Builder() {
        }

        public Builder maxSentenceWords(int maxSentenceWords) {
            this.maxSentenceWords = maxSentenceWords;
            return this;
        }

        public Builder maxFactTokens(int maxFactTokens) {
            this.maxFactTokens = maxFactTokens;
            return this;
        }

        public Builder factSentenceClassifier(FactSentenceClassifier classifier) {
            this.factSentenceClassifier = classifier;
            return this;
        }

        public Builder forbiddenVerbs(List<String> verbs) {
            this.forbiddenVerbs.addAll(verbs);
            return this;
        }

        public Builder forbiddenPatterns(List<String> patterns) {
            this.forbiddenPatterns.addAll(patterns);
            return this;
        }

        public Builder forbiddenTerms(List<String> terms) {
            this.forbiddenTerms.addAll(terms);
            return this;
        }

        public Builder missingSourceSeverity(Severity severity) {
            this.missingSourceSeverity = severity;
            return this;
        }

        public Builder nullableSourceTypes(Set<FieldType> types) {
            this.nullableSourceTypes.addAll(types);
            return this;
        }

        /**
         * Replace the required metadata fields (default:
         * {@code extraction_date}, {@code model}, {@code extractor_version}).
         */
        public Builder requiredMetadataFields(List<String> fields) {
            this.requiredMetadataFields.clear();
            this.requiredMetadataFields.addAll(fields);
            return this;
        }

        public Builder field(FieldDescriptor descriptor) {
            this.fieldDescriptors.add(descriptor);
            return this;
        }

        public Builder fields(List<FieldDescriptor> descriptors) {
            this.fieldDescriptors.addAll(descriptors);
            return this;
        }

        /**
         * Add numbers that body text may always contain, as literals
         * ({@code "14"}, {@code "1,000"}).
         */
        public Builder allowedNumbers(List<String> numbers) {
            this.allowedNumbers.addAll(numbers);
            return this;
        }

        /**
         * Replace the enabled number exclusions (default: all).
         */
        public Builder numberExclusions(Set<NumberExclusion> exclusions) {
            this.numberExclusions.clear();
            this.numberExclusions.addAll(exclusions);
            return this;
        }

        public Builder override(OverrideRecord override) {
            this.overrides.add(override);
            return this;
        }

        public Builder overrides(List<OverrideRecord> overrides) {
            this.overrides.addAll(overrides);
            return this;
        }

        /**
         * Validate and build the configuration, compiling every pattern.
         *
         * @return the immutable configuration
         * @throws IllegalStateException listing every invalid value
         */
        public RuleConfig build() {
            List<String> errors = new ArrayList<>();

            if (maxSentenceWords <= 0) {
                errors.add("'max_sentence_words' must be > 0, got: " + maxSentenceWords);
            }
            if (maxFactTokens <= 0) {
                errors.add("'max_fact_tokens' must be > 0, got: " + maxFactTokens);
            }
            if (factSentenceClassifier == null) {
                errors.add("Fact sentence classifier is required");
            }
            if (missingSourceSeverity == null) {
                errors.add("'missing_source_severity' is required");
            }

            List<ForbiddenRule> rules = new ArrayList<>();
            compileWords(ForbiddenRule.Kind.VERB, forbiddenVerbs, rules, errors);
            compileWords(ForbiddenRule.Kind.TERM, forbiddenTerms, rules, errors);
            for (String regex : forbiddenPatterns) {
                if (regex == null || regex.isEmpty()) {
                    errors.add("Forbidden pattern must not be empty");
                    continue;
                }
                try {
                    rules.add(new ForbiddenRule(ForbiddenRule.Kind.PATTERN, regex,
                            Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
                } catch (PatternSyntaxException e) {
                    errors.add("Invalid forbidden pattern '" + regex + "': " + e.getDescription());
                }
            }

            Set<String> names = new HashSet<>();
            for (FieldDescriptor descriptor : fieldDescriptors) {
                if (descriptor == null) {
                    errors.add("Field descriptor must not be null");
                } else if (!names.add(descriptor.getName())) {
                    errors.add("Duplicate field descriptor: '" + descriptor.getName() + "'");
                } else if (descriptor.getName().startsWith("_")) {
                    errors.add("Field name must not start with '_': '" + descriptor.getName() + "'");
                }
            }
            for (String field : requiredMetadataFields) {
                if (field == null || field.isBlank()) {
                    errors.add("Required metadata field name must not be blank");
                }
            }

            Set<String> normalizedAllowed = new LinkedHashSet<>();
            for (String number : allowedNumbers) {
                String literal = number == null ? null : number.trim();
                NumberNormalizer.normalizeLiteral(literal).ifPresentOrElse(normalizedAllowed::add,
                        () -> errors.add("Allowed number is not a numeric literal: '" + number + "'"));
            }

            for (OverrideRecord override : overrides) {
                if (override == null) {
                    errors.add("Override must not be null");
                    continue;
                }
                try {
                    override.validate();
                } catch (IllegalStateException e) {
                    errors.add(e.getMessage());
                }
            }

            if (!errors.isEmpty()) {
                throw new IllegalStateException(
                        "Rule configuration validation failed:\n  - "
                                + String.join("\n  - ", errors));
            }
            return new RuleConfig(this, rules, normalizedAllowed);
        }

        private static void compileWords(ForbiddenRule.Kind kind, List<String> words,
                                         List<ForbiddenRule> out, List<String> errors) {
            for (String word : words) {
                if (word == null || word.isBlank()) {
                    errors.add("Forbidden " + kind.value() + " must not be blank");
                    continue;
                }
                String trimmed = word.trim();
                out.add(new ForbiddenRule(kind, trimmed,
                        Pattern.compile("(?<![\\p{L}\\p{N}_])" + Pattern.quote(trimmed.toLowerCase(Locale.ROOT))
                                        + "(?![\\p{L}\\p{N}_])",
                                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getMaxSentenceWords() {
        return maxSentenceWords;
    }

    public int getMaxFactTokens() {
        return maxFactTokens;
    }

    public FactSentenceClassifier getFactSentenceClassifier() {
        return factSentenceClassifier;
    }

    public List<String> getForbiddenVerbs() {
        return forbiddenVerbs;
    }

    public List<String> getForbiddenPatterns() {
        return forbiddenPatterns;
    }

    public List<String> getForbiddenTerms() {
        return forbiddenTerms;
    }

    /**
     * @return compiled rules: verbs, then terms, then patterns, each in
     *         configured order
     */
    public List<ForbiddenRule> getForbiddenRules() {
        return forbiddenRules;
    }

    public Severity getMissingSourceSeverity() {
        return missingSourceSeverity;
    }

    public Set<FieldType> getNullableSourceTypes() {
        return nullableSourceTypes;
    }

    public List<String> getRequiredMetadataFields() {
        return requiredMetadataFields;
    }

    public List<FieldDescriptor> getFieldDescriptors() {
        return fieldDescriptors;
    }

    public FieldMentions getFieldMentions() {
        return fieldMentions;
    }

    /**
     * @return normalized numbers that are always grounded
     */
    public Set<String> getAllowedNumbers() {
        return allowedNumbers;
    }

    public Set<NumberExclusion> getNumberExclusions() {
        return numberExclusions;
    }

    public List<OverrideRecord> getOverrides() {
        return overrides;
    }

    /**
     * @param descriptor a declared field
     * @return {@code true} if the field's {@code X_source} may be empty
     */
    public boolean isSourceNullable(FieldDescriptor descriptor) {
        return descriptor.isSourceNullable() || nullableSourceTypes.contains(descriptor.getType());
    }

    @Override
    public String toString() {
        return "RuleConfig{" +
                "maxSentenceWords=" + maxSentenceWords +
                ", maxFactTokens=" + maxFactTokens +
                ", forbiddenRules=" + forbiddenRules.size() +
                ", missingSourceSeverity=" + missingSourceSeverity +
                ", nullableSourceTypes=" + nullableSourceTypes +
                ", fields=" + fieldDescriptors.size() +
                ", allowedNumbers=" + allowedNumbers +
                ", numberExclusions=" + numberExclusions +
                ", overrides=" + overrides.size() +
                '}';
    }
}
