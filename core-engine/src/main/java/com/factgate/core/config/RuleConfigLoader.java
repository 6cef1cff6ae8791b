package com.factgate.core.config;

import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.FieldType;
import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.Severity;
import com.factgate.core.text.FactSentenceClassifiers;
import com.factgate.core.text.NumberExclusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads a {@link RuleConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Format</h3>
 *
 * <pre>
 * thresholds:
 *   max_sentence_words: 22
 *   max_fact_tokens: 18
 *   fact_sentence_classifier: numeric_or_field
 * lexicon_rules:
 *   forbidden_verbs: [guarantee]
 *   forbidden_patterns: ["with regard to"]
 *   forbidden_terms: [always]
 * field_policy:
 *   missing_source_severity: warning
 *   nullable_source_types: [enum]
 *   required_metadata_fields: [extraction_date, model, extractor_version]
 * fields:
 *   - name: fee_amount
 *     type: numeric
 *     nullable_source: false
 *     aliases: [fee]
 * number_grounding:
 *   allowed_numbers: ["14"]
 *   exclusions: [iso_date, ordinal, list_index, year]
 * overrides: []
 * </pre>
 *
 * <h3>Validation</h3>
 * <p>
 * Every binding problem (wrong value types, unknown enum values, invalid
 * regexes, duplicate fields) is collected and thrown together as one
 * {@link IllegalStateException}, so the application <strong>fails
 * fast</strong> on a broken configuration.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "FACT_GATE_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "rules.yml";

    private RuleConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution: the file named by
     * {@value #ENV_CONFIG_PATH} if it exists, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return the configuration
     * @throws IllegalStateException if the configuration is invalid
     */
    public static RuleConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading rule config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading rule config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return the configuration
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or the configuration is
     *                                  invalid
     */
    public static RuleConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return the configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or the configuration is
     *                                  invalid
     */
    public static RuleConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RuleConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse a configuration from YAML text.
     *
     * @param yaml YAML document; must not be {@code null}
     * @return the configuration
     * @throws IllegalStateException if the configuration is invalid
     */
    public static RuleConfig fromYaml(String yaml) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        Object root;
        try {
            root = newYaml().load(new StringReader(yaml));
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid YAML in rule config <string>: " + e.getMessage(), e);
        }
        return bind(root, "<string>");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    private static RuleConfig parse(InputStream is, String origin) {
        Object root;
        try {
            root = newYaml().load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Invalid YAML in rule config " + origin + ": " + e.getMessage(), e);
        }
        return bind(root, origin);
    }

    private static RuleConfig bind(Object root, String origin) {
        RuleConfig.Builder builder = RuleConfig.builder();
        if (root == null) {
            LOG.warn("Rule config {} is empty - using defaults", origin);
            return builder.build();
        }
        List<String> errors = new ArrayList<>();
        Map<?, ?> doc = asMap(root, "<root>", errors);
        if (doc != null) {
            bindThresholds(asMap(doc.get("thresholds"), "thresholds", errors), builder, errors);
            bindLexicon(asMap(doc.get("lexicon_rules"), "lexicon_rules", errors), builder, errors);
            bindFieldPolicy(asMap(doc.get("field_policy"), "field_policy", errors), builder, errors);
            bindFields(doc.get("fields"), builder, errors);
            bindNumberGrounding(asMap(doc.get("number_grounding"), "number_grounding", errors), builder, errors);
            bindOverrides(doc.get("overrides"), builder, errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rule configuration " + origin + " validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
        RuleConfig config = builder.build();
        LOG.info("Loaded rule config from {}: {}", origin, config);
        return config;
    }

    private static void bindThresholds(Map<?, ?> section, RuleConfig.Builder builder, List<String> errors) {
        if (section == null) {
            return;
        }
        Integer words = asInt(section.get("max_sentence_words"), "thresholds.max_sentence_words", errors);
        if (words != null) {
            builder.maxSentenceWords(words);
        }
        Integer tokens = asInt(section.get("max_fact_tokens"), "thresholds.max_fact_tokens", errors);
        if (tokens != null) {
            builder.maxFactTokens(tokens);
        }
        String classifier = asString(section.get("fact_sentence_classifier"),
                "thresholds.fact_sentence_classifier", errors);
        if (classifier != null) {
            try {
                builder.factSentenceClassifier(FactSentenceClassifiers.named(classifier));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
    }

    private static void bindLexicon(Map<?, ?> section, RuleConfig.Builder builder, List<String> errors) {
        if (section == null) {
            return;
        }
        builder.forbiddenVerbs(asStringList(section.get("forbidden_verbs"), "lexicon_rules.forbidden_verbs", errors));
        builder.forbiddenPatterns(asStringList(section.get("forbidden_patterns"), "lexicon_rules.forbidden_patterns", errors));
        builder.forbiddenTerms(asStringList(section.get("forbidden_terms"), "lexicon_rules.forbidden_terms", errors));
    }

    private static void bindFieldPolicy(Map<?, ?> section, RuleConfig.Builder builder, List<String> errors) {
        if (section == null) {
            return;
        }
        String sourceSeverity = asString(section.get("missing_source_severity"),
                "field_policy.missing_source_severity", errors);
        if (sourceSeverity != null) {
            try {
                builder.missingSourceSeverity(Severity.fromValue(sourceSeverity));
            } catch (IllegalArgumentException e) {
                errors.add("field_policy.missing_source_severity: " + e.getMessage());
            }
        }
        String verifiedAtSeverity = asString(section.get("missing_verified_at_severity"),
                "field_policy.missing_verified_at_severity", errors);
        if (verifiedAtSeverity != null && !"error".equalsIgnoreCase(verifiedAtSeverity.trim())) {
            LOG.warn("field_policy.missing_verified_at_severity='{}' is ignored: a missing or malformed "
                    + "verification date is always an error", verifiedAtSeverity);
        }
        Set<FieldType> nullable = new LinkedHashSet<>();
        for (String type : asStringList(section.get("nullable_source_types"), "field_policy.nullable_source_types", errors)) {
            try {
                nullable.add(FieldType.fromValue(type));
            } catch (IllegalArgumentException e) {
                errors.add("field_policy.nullable_source_types: " + e.getMessage());
            }
        }
        builder.nullableSourceTypes(nullable);
        if (section.containsKey("required_metadata_fields")) {
            builder.requiredMetadataFields(asStringList(section.get("required_metadata_fields"),
                    "field_policy.required_metadata_fields", errors));
        }
    }

    private static void bindFields(Object raw, RuleConfig.Builder builder, List<String> errors) {
        List<?> entries = asList(raw, "fields", errors);
        for (int i = 0; i < entries.size(); i++) {
            String where = "fields[" + i + "]";
            Map<?, ?> entry = asMap(entries.get(i), where, errors);
            if (entry == null) {
                if (entries.get(i) == null) {
                    errors.add("'" + where + "' must not be empty");
                }
                continue;
            }
            String name = asString(entry.get("name"), where + ".name", errors);
            String type = asString(entry.get("type"), where + ".type", errors);
            if (name == null || name.isBlank()) {
                errors.add(where + ".name is required");
                continue;
            }
            if (type == null) {
                errors.add(where + ".type is required for field '" + name + "'");
                continue;
            }
            try {
                builder.field(FieldDescriptor.builder()
                        .name(name.trim())
                        .type(FieldType.fromValue(type))
                        .sourceNullable(Boolean.TRUE.equals(asBoolean(entry.get("nullable_source"),
                                where + ".nullable_source", errors)))
                        .aliases(asStringList(entry.get("aliases"), where + ".aliases", errors))
                        .build());
            } catch (IllegalArgumentException e) {
                errors.add(where + ": " + e.getMessage());
            }
        }
    }

    private static void bindNumberGrounding(Map<?, ?> section, RuleConfig.Builder builder, List<String> errors) {
        if (section == null) {
            return;
        }
        List<String> allowed = new ArrayList<>();
        for (Object number : asList(section.get("allowed_numbers"), "number_grounding.allowed_numbers", errors)) {
            if (number instanceof String || number instanceof Number) {
                allowed.add(number.toString());
            } else {
                errors.add("number_grounding.allowed_numbers entries must be numbers or strings, got: " + number);
            }
        }
        builder.allowedNumbers(allowed);
        if (section.containsKey("exclusions")) {
            Set<NumberExclusion> exclusions = new LinkedHashSet<>();
            for (String name : asStringList(section.get("exclusions"), "number_grounding.exclusions", errors)) {
                try {
                    exclusions.add(NumberExclusion.fromValue(name));
                } catch (IllegalArgumentException e) {
                    errors.add("number_grounding.exclusions: " + e.getMessage());
                }
            }
            builder.numberExclusions(exclusions);
        }
    }

    private static void bindOverrides(Object raw, RuleConfig.Builder builder, List<String> errors) {
        List<?> entries = asList(raw, "overrides", errors);
        for (int i = 0; i < entries.size(); i++) {
            String where = "overrides[" + i + "]";
            Map<?, ?> entry = asMap(entries.get(i), where, errors);
            if (entry == null) {
                if (entries.get(i) == null) {
                    errors.add("'" + where + "' must not be empty");
                }
                continue;
            }
            try {
                builder.override(new OverrideRecord(
                        asString(entry.get("rule"), where + ".rule", errors),
                        asString(entry.get("field"), where + ".field", errors),
                        asString(entry.get("reason"), where + ".reason", errors),
                        asString(entry.get("approved_by"), where + ".approved_by", errors),
                        toLocalDate(entry.get("expires_at")),
                        toInstant(entry.get("logged_at"))));
            } catch (DateTimeParseException e) {
                errors.add(where + ": invalid date '" + e.getParsedString() + "'");
            }
        }
    }

    // ---------------------------------------------------------------
    // Value coercion
    // ---------------------------------------------------------------

    private static Map<?, ?> asMap(Object value, String where, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        errors.add("'" + where + "' must be a mapping, got: " + value);
        return null;
    }

    private static List<?> asList(Object value, String where, List<String> errors) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        errors.add("'" + where + "' must be a list, got: " + value);
        return List.of();
    }

    private static List<String> asStringList(Object value, String where, List<String> errors) {
        List<String> strings = new ArrayList<>();
        for (Object item : asList(value, where, errors)) {
            if (item instanceof String s) {
                strings.add(s);
            } else {
                errors.add("'" + where + "' entries must be strings, got: " + item);
            }
        }
        return strings;
    }

    private static String asString(Object value, String where, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        errors.add("'" + where + "' must be a string, got: " + value);
        return null;
    }

    private static Integer asInt(Object value, String where, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        errors.add("'" + where + "' must be an integer, got: " + value);
        return null;
    }

    private static Boolean asBoolean(Object value, String where, List<String> errors) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        errors.add("'" + where + "' must be true or false, got: " + value);
        return null;
    }

    // SnakeYAML resolves unquoted timestamps to java.util.Date
    private static LocalDate toLocalDate(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        }
        return value == null ? null : LocalDate.parse(value.toString().trim());
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return value == null ? null : Instant.parse(value.toString().trim());
    }
}
