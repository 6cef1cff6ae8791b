/**
 * Domain model classes for Fact Gate.
 *
 * <p>
 * This package contains the value objects shared between the validators,
 * the engine and the command-line layer:
 * </p>
 * <ul>
 * <li>{@link com.factgate.core.model.WorkProduct} — read-only JSON document
 * wrapper</li>
 * <li>{@link com.factgate.core.model.FieldDescriptor} — declared factual
 * field</li>
 * <li>{@link com.factgate.core.model.ValidationFinding} — one problem found
 * by one validator</li>
 * <li>{@link com.factgate.core.model.ValidationReport} — merged findings and
 * the pass/fail decision</li>
 * <li>{@link com.factgate.core.model.OverrideRecord} — time-bounded
 * suppression of one error rule for one field</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.factgate.core.model;
