package com.factgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of validating one work product.
 *
 * <p>
 * {@code errors} holds every error found, including those excused by an
 * active override; {@code suppressed_errors} records which errors were
 * excused and by which override. The report {@link #isPassed() passed} iff
 * every error is suppressed.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"passed", "errors", "warnings", "suppressed_errors"})
public final class ValidationReport {

    private final List<ValidationFinding> errors;
    private final List<ValidationFinding> warnings;
    private final List<Suppression> suppressedErrors;

    public ValidationReport(List<ValidationFinding> errors,
                            List<ValidationFinding> warnings,
                            List<Suppression> suppressedErrors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(errors, "errors must not be null")));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(warnings, "warnings must not be null")));
        this.suppressedErrors = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(suppressedErrors, "suppressedErrors must not be null")));
    }

    @JsonProperty("passed")
    public boolean isPassed() {
        return blockingErrors().isEmpty();
    }

    public List<ValidationFinding> getErrors() {
        return errors;
    }

    public List<ValidationFinding> getWarnings() {
        return warnings;
    }

    @JsonProperty("suppressed_errors")
    public List<Suppression> getSuppressedErrors() {
        return suppressedErrors;
    }

    /**
     * @return errors not excused by any override, in report order
     */
    @JsonIgnore
    public List<ValidationFinding> blockingErrors() {
        List<ValidationFinding> blocking = new ArrayList<>();
        for (ValidationFinding error : errors) {
            if (!isSuppressed(error)) {
                blocking.add(error);
            }
        }
        return blocking;
    }

    /**
     * @param error a finding from {@link #getErrors()}
     * @return {@code true} if an active override excused it
     */
    public boolean isSuppressed(ValidationFinding error) {
        for (Suppression s : suppressedErrors) {
            if (s.getError().equals(error)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationReport that))
            return false;
        return errors.equals(that.errors)
                && warnings.equals(that.warnings)
                && suppressedErrors.equals(that.suppressedErrors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errors, warnings, suppressedErrors);
    }

    @Override
    public String toString() {
        return "ValidationReport{" +
                "passed=" + isPassed() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                ", suppressed=" + suppressedErrors.size() +
                '}';
    }

    /**
     * An error excused by an active override.
     */
    @JsonPropertyOrder({"error", "override"})
    public static final class Suppression {

        private final ValidationFinding error;
        private final OverrideRecord override;

        public Suppression(ValidationFinding error, OverrideRecord override) {
            this.error = Objects.requireNonNull(error, "error must not be null");
            this.override = Objects.requireNonNull(override, "override must not be null");
        }

        public ValidationFinding getError() {
            return error;
        }

        public OverrideRecord getOverride() {
            return override;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Suppression that))
                return false;
            return error.equals(that.error) && override.equals(that.override);
        }

        @Override
        public int hashCode() {
            return Objects.hash(error, override);
        }

        @Override
        public String toString() {
            return "Suppression{" + error.getRuleId() + " by " + override.key() + '}';
        }
    }
}
