package com.factgate.cli;

import com.factgate.core.json.ReportJson;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.ValidationReport;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Renders a {@link ValidationReport} for the terminal.
 *
 * <p>
 * Text mode lists every error (suppressed ones marked with the override that
 * excused them) and every warning, then a pass/fail line. Quiet mode drops
 * the header, the warnings and the success line. JSON mode prints the
 * report as serialized by {@link ReportJson}.
 * </p>
 */
public final class ReportPrinter {

    private final PrintStream out;

    public ReportPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    public void print(String label, ValidationReport report, CliOptions options) {
        if (options.isJson()) {
            out.println(ReportJson.toJson(report));
            return;
        }
        if (!options.isQuiet()) {
            out.println("Validating: " + label);
            out.println();
        }

        List<ValidationFinding> errors = report.getErrors();
        if (!errors.isEmpty()) {
            out.println("ERRORS:");
            for (ValidationFinding error : errors) {
                out.println("  - " + line(error) + suppressionNote(report, error));
            }
        }

        if (!report.getWarnings().isEmpty() && !options.isQuiet()) {
            out.println("WARNINGS:");
            for (ValidationFinding warning : report.getWarnings()) {
                out.println("  - " + line(warning));
            }
        }

        if (report.isPassed()) {
            if (!options.isQuiet()) {
                out.println();
                out.println("✓ Validation passed");
            }
        } else {
            out.println();
            out.println("✗ Validation failed (" + report.blockingErrors().size() + " blocking error(s))");
        }
    }

    private static String line(ValidationFinding finding) {
        return "[" + finding.getRuleId() + "] " + finding.location() + ": " + finding.getMessage();
    }

    private static String suppressionNote(ValidationReport report, ValidationFinding error) {
        for (ValidationReport.Suppression s : report.getSuppressedErrors()) {
            if (s.getError().equals(error)) {
                return " (overridden until " + s.getOverride().getExpiresAt()
                        + ", approved by " + s.getOverride().getApprovedBy() + ")";
            }
        }
        return "";
    }
}
