package com.factgate.core.validation;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.Severity;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.WorkProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks that a work product carries its provenance.
 *
 * <ol>
 * <li>{@code _metadata} must be present (error {@code missing_metadata}),
 * must be an object, and must hold every required metadata field with a
 * non-empty value.</li>
 * <li>For every declared factual field {@code X} present in the document,
 * {@code X_verified_at} must be present (error {@code missing_verified_at})
 * and read {@code YYYY-MM-DD} (error {@code invalid_date_format}); both are
 * errors whatever the field policy says.</li>
 * <li>{@code X_source} must be present and non-empty unless the field's source
 * is declared nullable; otherwise a {@code missing_source} finding with the
 * configured severity is reported.</li>
 * </ol>
 *
 * <p>
 * Declared fields absent from the document are skipped. This validator is
 * <strong>stateless</strong>.
 * </p>
 *
 * @since 1.0.0
 */
public class ProvenanceValidator implements DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ProvenanceValidator.class);

    public static final String NAME = "provenance";

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    @Override
    public List<ValidationFinding> validate(ValidationContext context) {
        Objects.requireNonNull(context, "ValidationContext must not be null");
        WorkProduct workProduct = context.getWorkProduct();
        RuleConfig config = context.getConfig();
        List<ValidationFinding> findings = new ArrayList<>();

        checkMetadata(workProduct, config, findings);

        for (FieldDescriptor descriptor : config.getFieldDescriptors()) {
            if (!workProduct.has(descriptor.getName())) {
                LOG.trace("Field '{}' not used in this document - skipping", descriptor.getName());
                continue;
            }
            checkVerifiedAt(workProduct, descriptor, findings);
            checkSource(workProduct, descriptor, config, findings);
        }
        return findings;
    }

    @Override
    public String getName() {
        return NAME;
    }

    // ---------------------------------------------------------------
    // Checks
    // ---------------------------------------------------------------

    private void checkMetadata(WorkProduct workProduct, RuleConfig config, List<ValidationFinding> findings) {
        Optional<Object> metadata = workProduct.metadata();
        if (metadata.isEmpty()) {
            findings.add(error(RuleIds.MISSING_METADATA, WorkProduct.METADATA_KEY,
                    "Missing " + WorkProduct.METADATA_KEY + " block; the document is not verifiable"));
            return;
        }
        if (!(metadata.get() instanceof Map<?, ?> block)) {
            findings.add(error(RuleIds.INVALID_METADATA, WorkProduct.METADATA_KEY,
                    WorkProduct.METADATA_KEY + " must be an object"));
            return;
        }
        for (String required : config.getRequiredMetadataFields()) {
            String location = WorkProduct.METADATA_KEY + "." + required;
            if (!block.containsKey(required)) {
                findings.add(error(RuleIds.MISSING_METADATA_FIELD, location,
                        "Missing metadata field: " + required));
            } else if (isEmpty(block.get(required))) {
                findings.add(error(RuleIds.EMPTY_METADATA_FIELD, location,
                        "Empty metadata field: " + required));
            }
        }
    }

    private void checkVerifiedAt(WorkProduct workProduct, FieldDescriptor descriptor,
                                 List<ValidationFinding> findings) {
        String field = descriptor.getName();
        Optional<Object> verifiedAt = workProduct.verifiedAtOf(field);
        if (verifiedAt.isEmpty()) {
            findings.add(error(RuleIds.MISSING_VERIFIED_AT, field,
                    "Field '" + field + "' missing verification date (" + descriptor.verifiedAtKey() + ")"));
            return;
        }
        Object value = verifiedAt.get();
        if (!(value instanceof String date) || !ISO_DATE.matcher(date).matches()) {
            findings.add(error(RuleIds.INVALID_DATE_FORMAT, field,
                    "Field '" + field + "' has invalid date format: " + value + " (expected YYYY-MM-DD)"));
        }
    }

    private void checkSource(WorkProduct workProduct, FieldDescriptor descriptor, RuleConfig config,
                             List<ValidationFinding> findings) {
        if (config.isSourceNullable(descriptor)) {
            return;
        }
        String field = descriptor.getName();
        Optional<Object> source = workProduct.sourceOf(field);
        if (source.isEmpty() || isEmpty(source.get())) {
            Severity severity = config.getMissingSourceSeverity();
            String message = workProduct.has(descriptor.sourceKey())
                    ? "Field '" + field + "' requires non-empty source (" + descriptor.sourceKey() + ")"
                    : "Field '" + field + "' missing source key (" + descriptor.sourceKey() + ")";
            LOG.debug("Rule [{}] fired for field '{}' with severity {}", RuleIds.MISSING_SOURCE, field, severity);
            findings.add(ValidationFinding.builder()
                    .severity(severity)
                    .ruleId(RuleIds.MISSING_SOURCE)
                    .validator(NAME)
                    .field(field)
                    .message(message)
                    .build());
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static ValidationFinding error(String ruleId, String field, String message) {
        LOG.debug("Rule [{}] fired for '{}'", ruleId, field);
        return ValidationFinding.builder()
                .error()
                .ruleId(ruleId)
                .validator(NAME)
                .field(field)
                .message(message)
                .build();
    }
}
