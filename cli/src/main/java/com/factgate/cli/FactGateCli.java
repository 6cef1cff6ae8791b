package com.factgate.cli;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.config.RuleConfigLoader;
import com.factgate.core.json.OverrideLoader;
import com.factgate.core.json.WorkProductReader;
import com.factgate.core.model.MalformedDocumentException;
import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.ValidationReport;
import com.factgate.core.model.WorkProduct;
import com.factgate.core.validation.ValidationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for the Fact Gate command line.
 *
 * <h3>Commands</h3>
 *
 * <pre>
 *   validate-work-product &lt;file&gt;   provenance (+ lexicon and number grounding with --text)
 *   validate-text &lt;file&gt;           lexicon (+ number grounding with --work-product)
 * </pre>
 *
 * <h3>Exit Codes</h3>
 * <ul>
 * <li>{@code 0} – the report passed</li>
 * <li>{@code 1} – the report has blocking errors</li>
 * <li>{@code 2} – usage error, unreadable input, invalid configuration or a
 * malformed document</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class FactGateCli {

    private static final Logger LOG = LoggerFactory.getLogger(FactGateCli.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_ERROR = 2;

    private final Clock clock;
    private final ValidationEngine engine;
    private final PrintStream out;
    private final PrintStream err;

    FactGateCli(Clock clock, PrintStream out, PrintStream err) {
        this.clock = clock;
        this.engine = new ValidationEngine(clock);
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new FactGateCli(Clock.systemUTC(), System.out, System.err).run(args, System.getenv());
        System.exit(code);
    }

    /**
     * Run one invocation.
     *
     * @param args command-line arguments, command first
     * @param env  environment variables
     * @return the process exit code
     */
    int run(String[] args, Map<String, String> env) {
        CliOptions options;
        try {
            options = CliOptions.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_ERROR;
        }
        LOG.debug("Running with {}", options);

        try {
            RuleConfig config = loadConfig(options);
            ValidationReport report = switch (options.getCommand()) {
                case VALIDATE_WORK_PRODUCT -> validateWorkProduct(options, config);
                case VALIDATE_TEXT -> validateText(options, config);
            };
            new ReportPrinter(out).print(options.getInput().toString(), report, options);
            return report.isPassed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (MalformedDocumentException e) {
            err.println("Error: malformed document: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.debug("Invocation failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private RuleConfig loadConfig(CliOptions options) {
        RuleConfig config = options.getConfigPath()
                .map(path -> RuleConfigLoader.fromFile(path.toString()))
                .orElseGet(() -> RuleConfigLoader.fromClasspath(RuleConfigLoader.DEFAULT_RESOURCE));
        if (options.getOverridesPath().isPresent()) {
            List<OverrideRecord> overrides = OverrideLoader.fromFile(options.getOverridesPath().get());
            config = config.withOverrides(overrides);
        }
        return config;
    }

    private ValidationReport validateWorkProduct(CliOptions options, RuleConfig config) {
        WorkProduct workProduct = WorkProductReader.fromFile(options.getInput());
        String body = options.getCompanionPath().map(FactGateCli::readText).orElse(null);
        return engine.validate(workProduct, body, config, asOf(options));
    }

    private ValidationReport validateText(CliOptions options, RuleConfig config) {
        String body = readText(options.getInput());
        if (options.getCompanionPath().isPresent()) {
            WorkProduct workProduct = WorkProductReader.fromFile(options.getCompanionPath().get());
            return engine.validate(workProduct, body, config, asOf(options));
        }
        return engine.validateText(body, config, asOf(options));
    }

    private Instant asOf(CliOptions options) {
        return options.getAsOf().orElseGet(clock::instant);
    }

    private static String readText(Path path) {
        try {
            return Files.readString(path);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("File not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
