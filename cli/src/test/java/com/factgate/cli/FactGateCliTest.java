package com.factgate.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link FactGateCli}.
 */
class FactGateCliTest {

    private static final String RULES = String.join("\n",
            "lexicon_rules:",
            "  forbidden_verbs: [guarantee]",
            "  forbidden_terms: [always, guaranteed]",
            "field_policy:",
            "  missing_source_severity: error",
            "  required_metadata_fields: [model]",
            "fields:",
            "  - name: fee_amount",
            "    type: numeric",
            "    aliases: [fee]");

    private static final String WORK_PRODUCT = String.join("\n",
            "{",
            "  \"_metadata\": {\"model\": \"extractor-large\"},",
            "  \"fee_amount\": 25,",
            "  \"fee_amount_source\": \"https://example.gov/fees\",",
            "  \"fee_amount_verified_at\": \"2025-01-15\"",
            "}");

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private FactGateCli cli;
    private Path rules;
    private Path workProduct;

    @BeforeEach
    void setUp() throws IOException {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new FactGateCli(Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        rules = write("rules.yml", RULES);
        workProduct = write("wp.json", WORK_PRODUCT);
    }

    @Test
    @DisplayName("Should exit 0 for a clean work product and body")
    void shouldPassCleanInput() throws IOException {
        Path body = write("body.md", "The fee is 25 euros.");

        int code = run("validate-work-product", workProduct.toString(), "--config", rules.toString(),
                "--text", body.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_PASSED);
        assertThat(stdout()).contains("Validating: " + workProduct).contains("✓ Validation passed");
    }

    @Test
    @DisplayName("Should exit 1 and list errors when validation fails")
    void shouldFailOnErrors() throws IOException {
        Path body = write("body.md", "The fee is 25 euros, always guaranteed.");

        int code = run("validate-work-product", workProduct.toString(), "--config", rules.toString(),
                "--text", body.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_FAILED);
        assertThat(stdout())
                .contains("ERRORS:")
                .contains("[forbidden_language] @21: Forbidden term 'always'")
                .contains("✗ Validation failed (2 blocking error(s))");
    }

    @Test
    @DisplayName("Should print the report as JSON")
    void shouldPrintJson() throws IOException {
        Path body = write("body.md", "The fee is 45 euros.");

        int code = run("validate-work-product", workProduct.toString(), "--config", rules.toString(),
                "--text", body.toString(), "--json");

        assertThat(code).isEqualTo(FactGateCli.EXIT_FAILED);
        assertThat(stdout())
                .startsWith("{")
                .contains("\"rule_id\" : \"hallucinated_number\"")
                .doesNotContain("Validating:");
    }

    @Test
    @DisplayName("Overrides from the environment should suppress matching errors until they expire")
    void shouldApplyOverridesFromEnvironment() throws IOException {
        Path body = write("body.md", "The fee is 45 euros.");
        Path overrides = write("overrides.jsonl",
                "{\"type\": \"override\", \"rule\": \"hallucinated_number\", \"field\": \"fee_amount\","
                        + " \"reason\": \"Reduced fee confirmed\", \"approved_by\": \"a.editor\","
                        + " \"expires_at\": \"2025-12-31\"}");
        Map<String, String> env = Map.of(CliOptions.ENV_OVERRIDES_PATH, overrides.toString());
        String[] args = {"validate-work-product", workProduct.toString(), "--config", rules.toString(),
                "--text", body.toString()};

        int active = cli.run(args, env);
        String activeOutput = stdout();
        int expired = cli.run(append(args, "--as-of", "2026-01-01"), env);

        assertThat(active).isEqualTo(FactGateCli.EXIT_PASSED);
        assertThat(activeOutput).contains("(overridden until 2025-12-31, approved by a.editor)");
        assertThat(expired).isEqualTo(FactGateCli.EXIT_FAILED);
    }

    @Test
    @DisplayName("validate-text should check body text alone")
    void shouldValidateText() throws IOException {
        Path body = write("body.md", "We always answer. It costs 99 euros.");

        int code = run("validate-text", body.toString(), "--config", rules.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_FAILED);
        assertThat(stdout()).contains("forbidden_language").doesNotContain("hallucinated_number");
    }

    @Test
    @DisplayName("validate-text with a work product should also ground numbers")
    void shouldValidateTextAgainstWorkProduct() throws IOException {
        Path body = write("body.md", "It costs 99 euros.");

        int code = run("validate-text", body.toString(), "--config", rules.toString(),
                "--work-product", workProduct.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_FAILED);
        assertThat(stdout()).contains("hallucinated_number");
    }

    @Test
    @DisplayName("Should use the bundled rules when no config is given")
    void shouldUseBundledRules() throws IOException {
        Path body = write("body.md", "Offices are always open.");

        int code = run("validate-text", body.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_FAILED);
        assertThat(stdout()).contains("Forbidden term 'always'");
    }

    @Test
    @DisplayName("Quiet mode should print nothing for a passing report")
    void shouldStayQuietOnSuccess() throws IOException {
        Path body = write("body.md", "The fee is 25 euros.");

        int code = run("validate-text", body.toString(), "--config", rules.toString(), "--quiet");

        assertThat(code).isEqualTo(FactGateCli.EXIT_PASSED);
        assertThat(stdout()).isEmpty();
    }

    // ---------------------------------------------------------------
    // Exit code 2
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should exit 2 with usage for a bad command line")
    void shouldReportUsageErrors() {
        int code = run("lint");

        assertThat(code).isEqualTo(FactGateCli.EXIT_ERROR);
        assertThat(stderr()).contains("Unknown command: lint").contains("Usage:");
    }

    @Test
    @DisplayName("Should exit 2 for a missing input file")
    void shouldReportMissingFile() {
        int code = run("validate-work-product", dir.resolve("absent.json").toString(), "--config", rules.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_ERROR);
        assertThat(stderr()).contains("not found");
    }

    @Test
    @DisplayName("Should exit 2 for a malformed work product")
    void shouldReportMalformedDocument() throws IOException {
        Path broken = write("broken.json", "[1, 2, 3]");

        int code = run("validate-work-product", broken.toString(), "--config", rules.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_ERROR);
        assertThat(stderr()).contains("malformed document");
    }

    @Test
    @DisplayName("Should exit 2 for an invalid configuration")
    void shouldReportInvalidConfig() throws IOException {
        Path badRules = write("bad.yml", "thresholds:\n  max_sentence_words: -1\n");

        int code = run("validate-work-product", workProduct.toString(), "--config", badRules.toString());

        assertThat(code).isEqualTo(FactGateCli.EXIT_ERROR);
        assertThat(stderr()).contains("'max_sentence_words' must be > 0");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private int run(String... args) {
        return cli.run(args, Map.of());
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    private String stdout() {
        String text = out.toString(StandardCharsets.UTF_8);
        out.reset();
        return text;
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String[] append(String[] args, String... more) {
        String[] all = new String[args.length + more.length];
        System.arraycopy(args, 0, all, 0, args.length);
        System.arraycopy(more, 0, all, args.length, more.length);
        return all;
    }
}
