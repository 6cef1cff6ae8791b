package com.factgate.core.validation;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.OverrideRecord;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.ValidationReport;
import com.factgate.core.model.WorkProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the validators over one document and turns their findings into a
 * {@link ValidationReport}.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   WorkProduct (+ optional body text) + RuleConfig
 *     → ProvenanceValidator          (always)
 *     → LexiconValidator             (body text only)
 *     → NumberGroundingValidator     (body text only)
 *     → partition by severity, keeping validator order
 *     → excuse errors matched by an active override
 *     → ValidationReport
 * </pre>
 *
 * <h3>Overrides</h3>
 * <p>
 * An error is suppressed iff an override in the configuration has the same
 * {@code (rule_id, field)} and is still active at the as-of instant. A
 * suppressed error stays in the report's error list; it only stops counting
 * towards {@code passed}. Warnings are never suppressed.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The engine is stateless apart from its clock and performs no I/O. One
 * instance can validate many documents concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    private final Clock clock;
    private final List<DocumentValidator> validators;
    private final List<DocumentValidator> textValidators;

    /**
     * Engine using the system UTC clock for the default as-of instant.
     */
    public ValidationEngine() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock clock supplying the as-of instant when none is given
     */
    public ValidationEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        LexiconValidator lexicon = new LexiconValidator();
        this.validators = List.of(new ProvenanceValidator(), lexicon, new NumberGroundingValidator());
        this.textValidators = List.of(lexicon);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Validate a work product as of the engine clock's current instant.
     *
     * @see #validate(WorkProduct, String, RuleConfig, Instant)
     */
    public ValidationReport validate(WorkProduct workProduct, String body, RuleConfig config) {
        return validate(workProduct, body, config, clock.instant());
    }

    /**
     * Validate an already-parsed document.
     *
     * @param document parsed JSON value; must be a mapping
     * @throws com.factgate.core.model.MalformedDocumentException if
     *         {@code document} is not a mapping
     * @see #validate(WorkProduct, String, RuleConfig, Instant)
     */
    public ValidationReport validate(Object document, String body, RuleConfig config, Instant asOf) {
        return validate(WorkProduct.of(document), body, config, asOf);
    }

    /**
     * Validate a work product.
     *
     * @param workProduct the document; must not be {@code null}
     * @param body        associated body text; {@code null} or blank skips the
     *                    text validators
     * @param config      rule configuration including overrides; must not be
     *                    {@code null}
     * @param asOf        instant against which override expiry is evaluated;
     *                    must not be {@code null}
     * @return a fresh report
     */
    public ValidationReport validate(WorkProduct workProduct, String body, RuleConfig config, Instant asOf) {
        return run(validators, new ValidationContext(workProduct, body, config), asOf);
    }

    /**
     * Validate body text alone against the lexicon rules. Used when no work
     * product is available, so number grounding and provenance cannot run.
     *
     * @param body   the text; must not be {@code null}
     * @param config rule configuration; must not be {@code null}
     * @param asOf   instant against which override expiry is evaluated
     * @return a fresh report
     */
    public ValidationReport validateText(String body, RuleConfig config, Instant asOf) {
        Objects.requireNonNull(body, "body must not be null");
        return run(textValidators, new ValidationContext(WorkProduct.empty(), body, config), asOf);
    }

    /**
     * @see #validateText(String, RuleConfig, Instant)
     */
    public ValidationReport validateText(String body, RuleConfig config) {
        return validateText(body, config, clock.instant());
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    private ValidationReport run(List<DocumentValidator> pipeline, ValidationContext context, Instant asOf) {
        Objects.requireNonNull(asOf, "asOf must not be null");
        List<ValidationFinding> findings = new ArrayList<>();
        for (DocumentValidator validator : pipeline) {
            if (!validator.appliesTo(context)) {
                LOG.trace("Validator [{}] not applicable - skipping", validator.getName());
                continue;
            }
            List<ValidationFinding> found = validator.validate(context);
            LOG.debug("Validator [{}] reported {} finding(s)", validator.getName(), found.size());
            findings.addAll(found);
        }
        ValidationReport report = aggregate(findings, context.getConfig().getOverrides(), asOf);
        LOG.debug("Validation finished: {}", report);
        return report;
    }

    /**
     * Partition findings by severity and apply overrides.
     *
     * @param findings  findings in validator order
     * @param overrides override records, first match wins
     * @param asOf      instant against which expiry is evaluated
     * @return the report
     */
    static ValidationReport aggregate(List<ValidationFinding> findings, List<OverrideRecord> overrides,
                                      Instant asOf) {
        List<ValidationFinding> errors = new ArrayList<>();
        List<ValidationFinding> warnings = new ArrayList<>();
        List<ValidationReport.Suppression> suppressed = new ArrayList<>();

        for (ValidationFinding finding : findings) {
            if (!finding.isError()) {
                warnings.add(finding);
                continue;
            }
            errors.add(finding);
            for (OverrideRecord override : overrides) {
                if (!override.matches(finding)) {
                    continue;
                }
                if (override.isActiveAt(asOf)) {
                    LOG.debug("Error {} suppressed by override {}", finding, override);
                    suppressed.add(new ValidationReport.Suppression(finding, override));
                    break;
                }
                LOG.debug("Override {} expired on {} - not applied", override.key(), override.getExpiresAt());
            }
        }
        return new ValidationReport(errors, warnings, suppressed);
    }
}
