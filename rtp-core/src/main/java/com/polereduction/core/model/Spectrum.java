package com.polereduction.core.model;

import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Zero-padded forward transform of a profile together with the angular
 * wavenumber of every bin.
 *
 * <p>
 * Bins follow the standard discrete-frequency layout: zero first, then the
 * increasing positive wavenumbers, then the negative half starting at the
 * most negative. {@link #originalLength()} remembers how many samples the
 * unpadded profile had, so the inverse transform can discard the padding.
 * </p>
 *
 * @since 1.0.0
 */
public final class Spectrum {

    private final Complex[] values;
    private final double[] wavenumbers;
    private final int originalLength;

    /**
     * @param values         transform bins; ownership passes to the spectrum
     * @param wavenumbers    angular wavenumber (rad/m) per bin; ownership
     *                       passes to the spectrum
     * @param originalLength number of samples before padding
     * @throws IllegalArgumentException if the arrays differ in length or the
     *                                  original length exceeds it
     */
    public Spectrum(Complex[] values, double[] wavenumbers, int originalLength) {
        Objects.requireNonNull(values, "Spectrum values must not be null");
        Objects.requireNonNull(wavenumbers, "Wavenumbers must not be null");
        if (values.length != wavenumbers.length) {
            throw new IllegalArgumentException("Spectrum has " + values.length
                    + " bins but " + wavenumbers.length + " wavenumbers");
        }
        if (originalLength < 1 || originalLength > values.length) {
            throw new IllegalArgumentException("Original length must be in [1, "
                    + values.length + "], got: " + originalLength);
        }
        this.values = values;
        this.wavenumbers = wavenumbers;
        this.originalLength = originalLength;
    }

    /** @return padded length {@code M} */
    public int size() {
        return values.length;
    }

    public int originalLength() {
        return originalLength;
    }

    public Complex valueAt(int index) {
        return values[index];
    }

    public double wavenumberAt(int index) {
        return wavenumbers[index];
    }

    /** @return a copy of the transform bins */
    public Complex[] values() {
        return values.clone();
    }

    /** @return a copy of the wavenumber array */
    public double[] wavenumbers() {
        return wavenumbers.clone();
    }

    @Override
    public String toString() {
        return "Spectrum{bins=" + values.length + ", originalLength=" + originalLength + '}';
    }
}
