package com.polereduction.core.filter;

/**
 * Contract for edge-tapering windows.
 *
 * <p>
 * A window is a weight sequence that is {@code 1.0} over the centre of the
 * profile and rolls off towards both ends, so the implicit periodic extension
 * of a finite transform does not see a step at the boundary. Implementations
 * are stateless and thread-safe.
 * </p>
 */
public interface TaperWindow {

    /**
     * Compute the window weights.
     *
     * @param length number of samples; must be {@code >= 1}
     * @return a new array of {@code length} weights in {@code [0, 1]}
     */
    double[] weights(int length);

    /**
     * @return the fraction of the profile that is tapered
     */
    double getAlpha();
}
