package com.polereduction.core.filter;

import com.polereduction.core.model.Spectrum;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import java.util.Objects;

/**
 * Applies an operator to a spectrum and returns the real, unpadded signal.
 *
 * @since 1.0.0
 */
public final class InverseTransformer {

    private final FastFourierTransformer transformer =
            new FastFourierTransformer(DftNormalization.STANDARD);

    /**
     * @param spectrum padded forward transform
     * @param operator transfer function, one entry per bin
     * @return the first {@link Spectrum#originalLength()} samples of the real
     *         part of the inverse transform
     * @throws IllegalArgumentException if the operator length differs from the
     *                                  spectrum length
     */
    public double[] apply(Spectrum spectrum, Complex[] operator) {
        Objects.requireNonNull(spectrum, "Spectrum must not be null");
        Objects.requireNonNull(operator, "Operator must not be null");
        if (operator.length != spectrum.size()) {
            throw new IllegalArgumentException("Operator has " + operator.length
                    + " entries but the spectrum has " + spectrum.size() + " bins");
        }

        Complex[] product = new Complex[spectrum.size()];
        for (int i = 0; i < product.length; i++) {
            product[i] = spectrum.valueAt(i).multiply(operator[i]);
        }
        Complex[] signal = transformer.transform(product, TransformType.INVERSE);

        double[] result = new double[spectrum.originalLength()];
        for (int i = 0; i < result.length; i++) {
            result[i] = signal[i].getReal();
        }
        return result;
    }
}
