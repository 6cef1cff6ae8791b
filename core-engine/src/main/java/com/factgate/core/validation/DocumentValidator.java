package com.factgate.core.validation;

import com.factgate.core.model.ValidationFinding;

import java.util.List;

/**
 * Contract for all validators run by the {@link ValidationEngine}.
 *
 * <p>
 * Implementations are <strong>stateless</strong> and pure: the same context
 * always yields the same findings in the same order, and instances may be
 * shared across threads. Problems inside the document are returned as
 * findings, never thrown.
 * </p>
 */
public interface DocumentValidator {

    /**
     * Validate one document.
     *
     * @param context the inputs of this call
     * @return findings in the order they were found; empty if none
     */
    List<ValidationFinding> validate(ValidationContext context);

    /**
     * @param context the inputs of this call
     * @return {@code true} if this validator has anything to check
     */
    default boolean appliesTo(ValidationContext context) {
        return true;
    }

    /**
     * @return short validator name recorded on every finding
     */
    String getName();
}
