/**
 * Rule configuration for Fact Gate.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.factgate.core.config.RuleConfigLoader} into an immutable
 * {@link com.factgate.core.config.RuleConfig}. Every value is checked and
 * every pattern compiled when the configuration is built, so a broken rule
 * file fails fast.
 * </p>
 *
 * @since 1.0.0
 */
package com.factgate.core.config;
