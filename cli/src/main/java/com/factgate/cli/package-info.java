/**
 * Command-line interface for Fact Gate.
 *
 * <p>
 * This package wires the core validation engine into the
 * {@code validate-work-product} and {@code validate-text} commands.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.factgate.cli.FactGateCli} — main entry point</li>
 * <li>{@link com.factgate.cli.CliOptions} — argument and environment
 * resolution</li>
 * <li>{@link com.factgate.cli.ReportPrinter} — terminal output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.factgate.cli;
