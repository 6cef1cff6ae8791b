package com.factgate.core.validation;

import com.factgate.core.config.RuleConfig;
import com.factgate.core.model.WorkProduct;

import java.util.Objects;
import java.util.Optional;

/**
 * Inputs of one validation call: the work product, its optional body text
 * and the rule configuration. Immutable; nothing in it is mutated by the
 * validators.
 *
 * @since 1.0.0
 */
public final class ValidationContext {

    private final WorkProduct workProduct;
    private final String body;
    private final RuleConfig config;

    public ValidationContext(WorkProduct workProduct, String body, RuleConfig config) {
        this.workProduct = Objects.requireNonNull(workProduct, "workProduct must not be null");
        this.body = body;
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public WorkProduct getWorkProduct() {
        return workProduct;
    }

    /**
     * @return the body text, or empty if none was supplied or it is blank
     */
    public Optional<String> getBody() {
        return body == null || body.isBlank() ? Optional.empty() : Optional.of(body);
    }

    public RuleConfig getConfig() {
        return config;
    }
}
