package com.factgate.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A justified, time-bounded suppression of one error rule for one field.
 *
 * <p>
 * Overrides are persisted outside the engine (typically as
 * {@code {"type":"override", ...}} lines of the change log) and handed to the
 * engine through the rule configuration. An override never removes a
 * finding from a report; it only excuses a matching error when computing
 * whether the report passed.
 * </p>
 *
 * <h3>Expiry</h3>
 * <p>
 * An override is active while the validation instant lies strictly before
 * the start of {@code expires_at} (UTC). From that day on it no longer
 * applies.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(value = {"type"}, allowGetters = true, ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "rule", "field", "reason", "approved_by", "expires_at", "logged_at"})
public final class OverrideRecord {

    /** Value of the {@code type} discriminator in change-log entries. */
    public static final String TYPE = "override";

    private final String ruleId;
    private final String field;
    private final String justification;
    private final String approvedBy;
    private final LocalDate expiresAt;
    private final Instant loggedAt;

    @JsonCreator
    public OverrideRecord(@JsonProperty("rule") String ruleId,
                          @JsonProperty("field") String field,
                          @JsonProperty("reason") String justification,
                          @JsonProperty("approved_by") String approvedBy,
                          @JsonProperty("expires_at") LocalDate expiresAt,
                          @JsonProperty("logged_at") Instant loggedAt) {
        this.ruleId = ruleId;
        this.field = field;
        this.justification = justification;
        this.approvedBy = approvedBy;
        this.expiresAt = expiresAt;
        this.loggedAt = loggedAt;
    }

    /**
     * Check that the fields needed to apply this override are present.
     *
     * @throws IllegalStateException listing every missing field
     */
    public void validate() {
        StringBuilder missing = new StringBuilder();
        if (ruleId == null || ruleId.isBlank()) {
            missing.append(" 'rule'");
        }
        if (field == null || field.isBlank()) {
            missing.append(" 'field'");
        }
        if (expiresAt == null) {
            missing.append(" 'expires_at'");
        }
        if (justification == null || justification.isBlank()) {
            missing.append(" 'reason'");
        }
        if (approvedBy == null || approvedBy.isBlank()) {
            missing.append(" 'approved_by'");
        }
        if (missing.length() > 0) {
            throw new IllegalStateException("Invalid override " + this + ": missing" + missing);
        }
    }

    /**
     * @param asOf validation instant
     * @return {@code true} if this override still applies at {@code asOf}
     */
    public boolean isActiveAt(Instant asOf) {
        Objects.requireNonNull(asOf, "asOf must not be null");
        return expiresAt != null
                && asOf.isBefore(expiresAt.atStartOfDay(ZoneOffset.UTC).toInstant());
    }

    /**
     * @param finding a finding from a report
     * @return {@code true} if the finding's {@code (rule_id, field)} equals this
     *         override's
     */
    public boolean matches(ValidationFinding finding) {
        return Objects.equals(ruleId, finding.getRuleId())
                && Objects.equals(field, finding.getField());
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    @JsonProperty("rule")
    public String getRuleId() {
        return ruleId;
    }

    @JsonProperty("field")
    public String getField() {
        return field;
    }

    @JsonProperty("reason")
    public String getJustification() {
        return justification;
    }

    @JsonProperty("approved_by")
    public String getApprovedBy() {
        return approvedBy;
    }

    @JsonProperty("expires_at")
    public LocalDate getExpiresAt() {
        return expiresAt;
    }

    @JsonProperty("logged_at")
    public Instant getLoggedAt() {
        return loggedAt;
    }

    @JsonIgnore
    public String key() {
        return ruleId + "/" + field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof OverrideRecord that))
            return false;
        return Objects.equals(ruleId, that.ruleId)
                && Objects.equals(field, that.field)
                && Objects.equals(justification, that.justification)
                && Objects.equals(approvedBy, that.approvedBy)
                && Objects.equals(expiresAt, that.expiresAt)
                && Objects.equals(loggedAt, that.loggedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, field, justification, approvedBy, expiresAt, loggedAt);
    }

    @Override
    public String toString() {
        return "OverrideRecord{" +
                "rule='" + ruleId + '\'' +
                ", field='" + field + '\'' +
                ", approvedBy='" + approvedBy + '\'' +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
