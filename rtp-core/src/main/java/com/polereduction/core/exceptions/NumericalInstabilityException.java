package com.polereduction.core.exceptions;

/**
 * Raised when the field geometry drives the transfer-function denominator
 * to (numerically) zero, so the reduction operator is undefined.
 *
 * @since 1.0.0
 */
public class NumericalInstabilityException extends ReductionException {

    private static final long serialVersionUID = 1L;

    private final int wavenumberIndex;
    private final double denominatorMagnitude;

    /**
     * @param wavenumberIndex      index of the first offending wavenumber
     * @param denominatorMagnitude magnitude of the denominator at that index
     * @param epsilon              threshold the magnitude fell below
     */
    public NumericalInstabilityException(int wavenumberIndex, double denominatorMagnitude, double epsilon) {
        super(String.format(
                "Degenerate field geometry: |denominator|=%.3e < %.1e at wavenumber index %d",
                denominatorMagnitude, epsilon, wavenumberIndex));
        this.wavenumberIndex = wavenumberIndex;
        this.denominatorMagnitude = denominatorMagnitude;
    }

    public int getWavenumberIndex() {
        return wavenumberIndex;
    }

    public double getDenominatorMagnitude() {
        return denominatorMagnitude;
    }
}
