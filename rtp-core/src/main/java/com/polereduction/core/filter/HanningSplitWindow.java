package com.polereduction.core.filter;

/**
 * Window built from the two halves of a short Hann window placed around a
 * flat centre.
 *
 * <p>
 * With {@code m = floor(alpha·(n−1))}, the window is the first
 * {@code floor(m/2)} points of an {@code m}-point Hann window, then
 * {@code n − m} ones, then the remaining Hann points. For {@code m >= 2} the
 * first and last weights are zero; for {@code m = 1} the single Hann point is
 * {@code 1.0} and the window stays flat. Because the rising and falling halves
 * come from one Hann window, an odd {@code m} places its peak sample in the
 * falling half.
 * </p>
 *
 * @since 1.0.0
 */
public class HanningSplitWindow implements TaperWindow {

    private final double alpha;

    /**
     * @param alpha taper fraction in {@code [0, 1]}
     * @throws IllegalArgumentException if {@code alpha} is out of range
     */
    public HanningSplitWindow(double alpha) {
        if (!(alpha >= 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("Taper alpha must be within [0, 1], got: " + alpha);
        }
        this.alpha = alpha;
    }

    @Override
    public double[] weights(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Window length must be >= 1, got: " + length);
        }
        int taperLength = (int) (alpha * (length - 1));
        int rising = taperLength / 2;
        double[] hann = hann(taperLength);

        double[] window = new double[length];
        int pos = 0;
        for (int i = 0; i < rising; i++) {
            window[pos++] = hann[i];
        }
        for (int i = 0; i < length - taperLength; i++) {
            window[pos++] = 1.0;
        }
        for (int i = rising; i < taperLength; i++) {
            window[pos++] = hann[i];
        }
        return window;
    }

    @Override
    public double getAlpha() {
        return alpha;
    }

    /** Symmetric Hann window, {@code 0.5 − 0.5·cos(2πi/(m−1))}. */
    static double[] hann(int points) {
        if (points < 1) {
            return new double[0];
        }
        if (points == 1) {
            return new double[] { 1.0 };
        }
        double[] w = new double[points];
        for (int i = 0; i < points; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / (points - 1));
        }
        return w;
    }

    @Override
    public String toString() {
        return "HanningSplitWindow{alpha=" + alpha + '}';
    }
}
