package com.polereduction.core.filter;

import java.util.Arrays;

/**
 * Canonical Tukey (tapered cosine) window.
 *
 * <p>
 * Each end rises over {@code alpha·(n−1)/2} samples along a half cosine with
 * a continuous first derivative where it meets the flat centre. The first and
 * last weights are exactly zero whenever {@code alpha > 0}; {@code alpha = 0}
 * gives a rectangular window and {@code alpha = 1} a Hann window.
 * </p>
 *
 * @since 1.0.0
 */
public class TukeyWindow implements TaperWindow {

    private final double alpha;

    /**
     * @param alpha taper fraction in {@code [0, 1]}
     * @throws IllegalArgumentException if {@code alpha} is out of range
     */
    public TukeyWindow(double alpha) {
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
        double[] window = new double[length];
        if (alpha == 0.0 || length == 1) {
            Arrays.fill(window, 1.0);
            return window;
        }

        double span = alpha * (length - 1);
        int width = (int) Math.floor(span / 2.0);
        for (int i = 0; i < length; i++) {
            if (i <= width) {
                window[i] = 0.5 * (1.0 + Math.cos(Math.PI * (-1.0 + 2.0 * i / span)));
            } else if (i >= length - width - 1) {
                window[i] = 0.5 * (1.0 + Math.cos(Math.PI * (-2.0 / alpha + 1.0 + 2.0 * i / span)));
            } else {
                window[i] = 1.0;
            }
        }
        return window;
    }

    @Override
    public double getAlpha() {
        return alpha;
    }

    @Override
    public String toString() {
        return "TukeyWindow{alpha=" + alpha + '}';
    }
}
