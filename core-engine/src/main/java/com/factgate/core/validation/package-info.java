/**
 * Pluggable validation engine.
 *
 * <p>
 * All validators implement the
 * {@link com.factgate.core.validation.DocumentValidator} interface and are
 * run in a fixed order by
 * {@link com.factgate.core.validation.ValidationEngine}:
 * </p>
 * <ul>
 * <li>{@link com.factgate.core.validation.ProvenanceValidator} —
 * {@code _metadata}, {@code X_source} and {@code X_verified_at}</li>
 * <li>{@link com.factgate.core.validation.LexiconValidator} — forbidden
 * language and sentence length</li>
 * <li>{@link com.factgate.core.validation.NumberGroundingValidator} —
 * numbers in text must come from the work product</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.factgate.core.validation;
