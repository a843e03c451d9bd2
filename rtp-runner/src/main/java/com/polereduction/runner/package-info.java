/**
 * Command-line runner around the pole-reduction core.
 *
 * <p>
 * Reads a profile from CSV, reduces it on a background worker and writes the
 * input table back out with the result column set.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.polereduction.runner.PoleReductionRunner} — main entry
 * point</li>
 * <li>{@link com.polereduction.runner.RunnerConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.polereduction.runner.ReductionWorker} — background execution
 * with progress reporting</li>
 * <li>{@link com.polereduction.runner.ProfileTable} — delimited table with
 * column detection</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.polereduction.runner;
