package com.factgate.core.validation;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.FieldDescriptor;
import com.factgate.core.model.ValidationFinding;
import com.factgate.core.model.WorkProduct;
import com.factgate.core.text.NumberExclusion;
import com.factgate.core.text.NumberNormalizer;
import com.factgate.core.text.NumberScanner;
import com.factgate.core.text.NumericToken;
import com.factgate.core.text.Sentence;
import com.factgate.core.text.SentenceSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Anti-hallucination check: every number stated in the body text must appear
 * among the numbers of the work product's declared factual fields.
 *
 * <h3>Allowed numbers</h3>
 * <p>
 * The values of every declared factual field present in the document are
 * walked recursively: JSON numbers are taken as they are, strings are scanned
 * for numeric literals, lists and objects are descended into. Provenance
 * keys ({@code *_source}, {@code *_verified_at}) and {@code _metadata} never
 * contribute. Numbers from {@code number_grounding.allowed_numbers} are
 * always allowed.
 * </p>
 *
 * <h3>Matching</h3>
 * <p>
 * Exact set membership on the normalized form, no tolerance or rounding.
 * Candidates matched by an enabled {@link NumberExclusion} are skipped. Each
 * remaining candidate outside the allowed set yields an error
 * {@code hallucinated_number}, attributed to the first declared field
 * mentioned in the same sentence when there is one.
 * </p>
 *
 * @since 1.0.0
 */
public class NumberGroundingValidator implements DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(NumberGroundingValidator.class);

    public static final String NAME = "number_grounding";

    @Override
    public boolean appliesTo(ValidationContext context) {
        return context.getBody().isPresent();
    }

    @Override
    public List<ValidationFinding> validate(ValidationContext context) {
        Objects.requireNonNull(context, "ValidationContext must not be null");
        if (context.getBody().isEmpty()) {
            LOG.trace("No body text - skipping number grounding");
            return List.of();
        }
        String body = context.getBody().get();
        WorkProduct workProduct = context.getWorkProduct();
        RuleConfig config = context.getConfig();

        Set<String> allowed = allowedNumbers(workProduct, config);
        LOG.trace("Allowed numbers: {}", allowed);

        List<ValidationFinding> findings = new ArrayList<>();
        for (Sentence sentence : SentenceSplitter.split(body)) {
            List<String> mentioned = null;
            for (NumericToken token : NumberScanner.scan(sentence)) {
                if (isExcluded(token, body, config.getNumberExclusions())) {
                    continue;
                }
                if (allowed.contains(token.getNormalized())) {
                    continue;
                }
                if (mentioned == null) {
                    mentioned = config.getFieldMentions().mentionedIn(sentence.getText(), workProduct::has);
                }
                String field = mentioned.isEmpty() ? null : mentioned.get(0);
                LOG.debug("Rule [{}] fired at {}: '{}' (normalized {})",
                        RuleIds.HALLUCINATED_NUMBER, token.getStart(), token.getText(), token.getNormalized());

                ValidationFinding.Builder finding = ValidationFinding.builder()
                        .error()
                        .ruleId(RuleIds.HALLUCINATED_NUMBER)
                        .validator(NAME)
                        .offset(token.getStart())
                        .span(token.getText())
                        .message("Number '" + token.getText() + "' is not grounded in any factual field"
                                + " (possible hallucination)");
                if (field != null) {
                    finding.field(field);
                }
                findings.add(finding.build());
            }
        }
        return findings;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Collect the normalized numbers that body text may state.
     *
     * @param workProduct the document
     * @param config      rule configuration (declared fields, allowed numbers)
     * @return unmodifiable set, in discovery order
     */
    public static Set<String> allowedNumbers(WorkProduct workProduct, RuleConfig config) {
        Set<String> allowed = new LinkedHashSet<>();
        for (FieldDescriptor descriptor : config.getFieldDescriptors()) {
            workProduct.get(descriptor.getName()).ifPresent(value -> collect(value, allowed));
        }
        allowed.addAll(config.getAllowedNumbers());
        return Collections.unmodifiableSet(allowed);
    }

    private static void collect(Object value, Set<String> out) {
        if (value instanceof Number number) {
            NumberNormalizer.normalizeNumber(number).ifPresent(out::add);
        } else if (value instanceof String text) {
            for (NumericToken token : NumberScanner.scan(text)) {
                out.add(token.getNormalized());
            }
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                collect(item, out);
            }
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!isProvenanceKey(entry.getKey())) {
                    collect(entry.getValue(), out);
                }
            }
        }
    }

    private static boolean isProvenanceKey(Object key) {
        return key instanceof String k
                && (k.endsWith(WorkProduct.SOURCE_SUFFIX)
                || k.endsWith(WorkProduct.VERIFIED_AT_SUFFIX)
                || k.equals(WorkProduct.METADATA_KEY));
    }

    private static boolean isExcluded(NumericToken token, String body, Set<NumberExclusion> exclusions) {
        for (NumberExclusion exclusion : exclusions) {
            if (exclusion.excludes(token, body)) {
                LOG.trace("Number '{}' at {} excluded as {}", token.getText(), token.getStart(), exclusion.value());
                return true;
            }
        }
        return false;
    }
}
