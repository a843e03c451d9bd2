/**
 * Frequency-domain reduction-to-pole pipeline.
 *
 * <p>
 * {@link com.polereduction.core.filter.ReductionToPole} is the entry point
 * and composes the stages in order:
 * </p>
 * <ol>
 * <li>{@link com.polereduction.core.filter.Detrender} — least-squares linear
 * trend removal</li>
 * <li>{@link com.polereduction.core.filter.Taper} — edge window from
 * {@link com.polereduction.core.filter.TaperFactory}</li>
 * <li>{@link com.polereduction.core.filter.SpectralTransformer} — zero
 * padding, forward transform and wavenumbers</li>
 * <li>{@link com.polereduction.core.filter.OperatorBuilder} — transfer
 * function from the field geometry</li>
 * <li>{@link com.polereduction.core.filter.InverseTransformer} — filtering,
 * inverse transform and truncation</li>
 * </ol>
 *
 * <p>
 * Every stage is stateless; none of them modifies its input arrays.
 * </p>
 *
 * @since 1.0.0
 */
package com.polereduction.core.filter;
