package com.factgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A single problem reported by one validator.
 *
 * <p>
 * Findings are immutable and created fresh per validation call. The location
 * is either a field name (provenance findings, and text findings that could be
 * attributed to a declared field) or a character offset into the body text,
 * or both.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code severity}, {@code ruleId} and
 * {@code message} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"severity", "rule_id", "validator", "field", "offset", "span", "message"})
public final class ValidationFinding {

    private final Severity severity;
    private final String ruleId;
    private final String validator;
    private final String field;
    private final Integer offset;
    private final String span;
    private final String message;

    private ValidationFinding(Builder builder) {
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
        this.validator = builder.validator;
        this.field = builder.field;
        this.offset = builder.offset;
        this.span = builder.span;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link ValidationFinding} instances.
     */
    public static class Builder {
        private Severity severity;
        private String ruleId;
        private String validator;
        private String field;
        private Integer offset;
        private String span;
        private String message;

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder error() {
            return severity(Severity.ERROR);
        }

        public Builder warning() {
            return severity(Severity.WARNING);
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder validator(String validator) {
            this.validator = validator;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder span(String span) {
            this.span = span;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public ValidationFinding build() {
            return new ValidationFinding(this);
        }
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("rule_id")
    public String getRuleId() {
        return ruleId;
    }

    /**
     * @return name of the validator that produced this finding
     */
    public String getValidator() {
        return validator;
    }

    /**
     * @return the field this finding is attributed to, or {@code null}
     */
    public String getField() {
        return field;
    }

    /**
     * @return character offset into the body text, or {@code null} for
     *         document-level findings
     */
    public Integer getOffset() {
        return offset;
    }

    /**
     * @return the matched text, or {@code null}
     */
    public String getSpan() {
        return span;
    }

    public String getMessage() {
        return message;
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Render the location for human-readable output.
     *
     * @return {@code field}, {@code @offset}, {@code field@offset} or
     *         {@code document}
     */
    @JsonIgnore
    public String location() {
        if (field != null && offset != null) {
            return field + "@" + offset;
        }
        if (field != null) {
            return field;
        }
        if (offset != null) {
            return "@" + offset;
        }
        return "document";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationFinding that))
            return false;
        return severity == that.severity
                && ruleId.equals(that.ruleId)
                && Objects.equals(validator, that.validator)
                && Objects.equals(field, that.field)
                && Objects.equals(offset, that.offset)
                && Objects.equals(span, that.span)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, ruleId, validator, field, offset, span, message);
    }

    @Override
    public String toString() {
        return severity.value() + " " + ruleId + " [" + location() + "]: " + message;
    }
}
