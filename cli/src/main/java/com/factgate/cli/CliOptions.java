package com.factgate.cli;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable options of one CLI invocation.
 *
 * <p>
 * Values come from the command line; the config and overrides paths fall
 * back to environment variables ({@value #ENV_CONFIG_PATH},
 * {@value #ENV_OVERRIDES_PATH}) when not given as flags.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #parse(String[], Map)} for real invocations, or the
 * {@link Builder} in tests. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class CliOptions {

    public static final String ENV_CONFIG_PATH = "FACT_GATE_CONFIG_PATH";
    public static final String ENV_OVERRIDES_PATH = "FACT_GATE_OVERRIDES_PATH";

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  validate-work-product <file> [--config <path>] [--overrides <path>] [--text <file>]",
            "                               [--as-of YYYY-MM-DD] [--json] [--quiet]",
            "  validate-text <file> [--config <path>] [--overrides <path>] [--work-product <file>]",
            "                       [--as-of YYYY-MM-DD] [--json] [--quiet]",
            "",
            "Exit codes: 0 passed, 1 failed, 2 usage or input error");

    private final Command command;
    private final Path input;
    private final Path configPath;
    private final Path overridesPath;
    private final Path companionPath;
    private final Instant asOf;
    private final boolean json;
    private final boolean quiet;

    private CliOptions(Builder b) {
        this.command = b.command;
        this.input = b.input;
        this.configPath = b.configPath;
        this.overridesPath = b.overridesPath;
        this.companionPath = b.companionPath;
        this.asOf = b.asOf;
        this.json = b.json;
        this.quiet = b.quiet;
    }

    // ---------------------------------------------------------------
    // Factory — parse the command line
    // ---------------------------------------------------------------

    /**
     * Parse command-line arguments.
     *
     * @param args command-line arguments, command first
     * @param env  environment variables used for fallbacks
     * @return validated options
     * @throws IllegalArgumentException with a usage message if the arguments
     *                                  are invalid
     */
    public static CliOptions parse(String[] args, Map<String, String> env) {
        Objects.requireNonNull(args, "args must not be null");
        Objects.requireNonNull(env, "env must not be null");
        if (args.length == 0) {
            throw new IllegalArgumentException("Missing command");
        }
        Command command = Command.fromName(args[0])
                .orElseThrow(() -> new IllegalArgumentException("Unknown command: " + args[0]));

        Builder b = new Builder().command(command);
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> b.configPath(Path.of(value(args, ++i, arg)));
                case "--overrides" -> b.overridesPath(Path.of(value(args, ++i, arg)));
                case "--text" -> {
                    requireCommand(command, Command.VALIDATE_WORK_PRODUCT, arg);
                    b.companionPath(Path.of(value(args, ++i, arg)));
                }
                case "--work-product" -> {
                    requireCommand(command, Command.VALIDATE_TEXT, arg);
                    b.companionPath(Path.of(value(args, ++i, arg)));
                }
                case "--as-of" -> b.asOf(parseDate(value(args, ++i, arg)));
                case "--json" -> b.json(true);
                case "--quiet", "-q" -> b.quiet(true);
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (b.input != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    b.input(Path.of(arg));
                }
            }
        }
        if (b.configPath == null) {
            envPath(env, ENV_CONFIG_PATH).ifPresent(b::configPath);
        }
        if (b.overridesPath == null) {
            envPath(env, ENV_OVERRIDES_PATH).ifPresent(b::overridesPath);
        }
        return b.build();
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static void requireCommand(Command actual, Command expected, String option) {
        if (actual != expected) {
            throw new IllegalArgumentException("Option " + option + " is only valid for " + expected.commandName());
        }
    }

    private static Instant parseDate(String value) {
        try {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--as-of must be YYYY-MM-DD, got: " + value, e);
        }
    }

    private static Optional<Path> envPath(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(Path.of(value));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Command getCommand() {
        return command;
    }

    public Path getInput() {
        return input;
    }

    public Optional<Path> getConfigPath() {
        return Optional.ofNullable(configPath);
    }

    public Optional<Path> getOverridesPath() {
        return Optional.ofNullable(overridesPath);
    }

    /**
     * @return the body text file for {@code validate-work-product}, or the
     *         work product file for {@code validate-text}
     */
    public Optional<Path> getCompanionPath() {
        return Optional.ofNullable(companionPath);
    }

    /**
     * @return the as-of instant, or empty to use the current time
     */
    public Optional<Instant> getAsOf() {
        return Optional.ofNullable(asOf);
    }

    public boolean isJson() {
        return json;
    }

    public boolean isQuiet() {
        return quiet;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link CliOptions}. {@code command} and
     * {@code input} are required.
     */
    public static class Builder {
        private Command command;
        private Path input;
        private Path configPath;
        private Path overridesPath;
        private Path companionPath;
        private Instant asOf;
        private boolean json;
        private boolean quiet;

        public Builder command(Command v) {
            this.command = v;
            return this;
        }

        public Builder input(Path v) {
            this.input = v;
            return this;
        }

        public Builder configPath(Path v) {
            this.configPath = v;
            return this;
        }

        public Builder overridesPath(Path v) {
            this.overridesPath = v;
            return this;
        }

        public Builder companionPath(Path v) {
            this.companionPath = v;
            return this;
        }

        public Builder asOf(Instant v) {
            this.asOf = v;
            return this;
        }

        public Builder json(boolean v) {
            this.json = v;
            return this;
        }

        public Builder quiet(boolean v) {
            this.quiet = v;
            return this;
        }

        /**
         * @return validated options
         * @throws IllegalArgumentException if the command or input file is
         *                                  missing
         */
        public CliOptions build() {
            if (command == null) {
                throw new IllegalArgumentException("Missing command");
            }
            if (input == null) {
                throw new IllegalArgumentException("Missing input file for " + command.commandName());
            }
            return new CliOptions(this);
        }
    }

    @Override
    public String toString() {
        return "CliOptions{" +
                "command=" + command.commandName() +
                ", input=" + input +
                ", configPath=" + configPath +
                ", overridesPath=" + overridesPath +
                ", companionPath=" + companionPath +
                ", asOf=" + asOf +
                ", json=" + json +
                ", quiet=" + quiet +
                '}';
    }
}
