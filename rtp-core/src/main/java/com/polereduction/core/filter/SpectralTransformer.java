package com.polereduction.core.filter;

import com.polereduction.core.exceptions.ValidationException;
import com.polereduction.core.model.Spectrum;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Zero-pads a signal, transforms it to the wavenumber domain and builds the
 * matching angular-wavenumber array.
 *
 * <p>
 * The transform length {@code M} is the smallest power of two with
 * {@code M >= paddingFactor·n}. Padding moves the circular-wrap artefacts of
 * the implicit periodic extension away from the data.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpectralTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralTransformer.class);

    /** Largest transform length an {@code int}-indexed array can hold. */
    static final int MAX_TRANSFORM_LENGTH = 1 << 30;

    private final int paddingFactor;
    private final FastFourierTransformer transformer =
            new FastFourierTransformer(DftNormalization.STANDARD);

    /**
     * @param paddingFactor minimum ratio of transform length to signal length
     * @throws IllegalArgumentException if {@code paddingFactor < 1}
     */
    public SpectralTransformer(int paddingFactor) {
        if (paddingFactor < 1) {
            throw new IllegalArgumentException("Padding factor must be >= 1, got: " + paddingFactor);
        }
        this.paddingFactor = paddingFactor;
    }

    /**
     * @param signal windowed samples; left untouched
     * @param dx     sampling interval in metres
     * @return the padded spectrum with its wavenumbers
     * @throws ValidationException if {@code dx} is not positive and finite,
     *                             the signal is empty, or the padded length
     *                             would exceed {@value #MAX_TRANSFORM_LENGTH}
     */
    public Spectrum transform(double[] signal, double dx) {
        Objects.requireNonNull(signal, "Signal must not be null");
        if (signal.length == 0) {
            throw new ValidationException("signal must not be empty");
        }
        if (!(dx > 0.0) || Double.isInfinite(dx)) {
            throw new ValidationException("sampling interval dx must be > 0, got " + dx);
        }

        int length = paddedLength(signal.length);
        double[] padded = new double[length];
        System.arraycopy(signal, 0, padded, 0, signal.length);

        Complex[] values = transformer.transform(padded, TransformType.FORWARD);
        double[] wavenumbers = wavenumbers(length, dx);

        LOG.debug("Transformed {} samples into {} bins (dx={})", signal.length, length, dx);
        return new Spectrum(values, wavenumbers, signal.length);
    }

    /**
     * @param samples unpadded signal length
     * @return the smallest power of two not below {@code paddingFactor·samples}
     * @throws ValidationException if that length exceeds
     *                             {@value #MAX_TRANSFORM_LENGTH}
     */
    int paddedLength(int samples) {
        long target = (long) paddingFactor * samples;
        if (target > MAX_TRANSFORM_LENGTH) {
            throw new ValidationException("padded transform length " + target
                    + " exceeds the supported maximum of " + MAX_TRANSFORM_LENGTH);
        }
        int length = 1;
        while (length < target) {
            length <<= 1;
        }
        return length;
    }

    /**
     * Angular wavenumbers {@code 2π·f} of an {@code M}-point transform, in the
     * standard layout: {@code 0, 1, ..., M/2−1, −M/2, ..., −1} times
     * {@code 1/(M·dx)}.
     *
     * @param length transform length {@code M}
     * @param dx     sampling interval in metres
     * @return wavenumbers in rad/m
     */
    static double[] wavenumbers(int length, double dx) {
        double step = 2.0 * Math.PI / (length * dx);
        int positive = (length - 1) / 2 + 1;
        double[] k = new double[length];
        for (int i = 0; i < length; i++) {
            int index = i < positive ? i : i - length;
            k[i] = index * step;
        }
        return k;
    }

    public int getPaddingFactor() {
        return paddingFactor;
    }
}
