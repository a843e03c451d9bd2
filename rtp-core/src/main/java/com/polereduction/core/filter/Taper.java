package com.polereduction.core.filter;

import java.util.Objects;

/**
 * Multiplies a signal elementwise by a {@link TaperWindow}.
 *
 * @since 1.0.0
 */
public final class Taper {

    private final TaperWindow window;

    public Taper(TaperWindow window) {
        this.window = Objects.requireNonNull(window, "Taper window must not be null");
    }

    /**
     * @param signal samples to taper; left untouched
     * @return a new, tapered array of the same length
     */
    public double[] apply(double[] signal) {
        Objects.requireNonNull(signal, "Signal must not be null");
        double[] weights = window.weights(signal.length);
        double[] tapered = new double[signal.length];
        for (int i = 0; i < signal.length; i++) {
            tapered[i] = signal[i] * weights[i];
        }
        return tapered;
    }

    public TaperWindow getWindow() {
        return window;
    }
}
