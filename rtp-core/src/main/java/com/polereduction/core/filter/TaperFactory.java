package com.polereduction.core.filter;

import com.polereduction.core.model.TaperMode;

import java.util.Objects;

/**
 * Creates {@link TaperWindow} instances from a {@link TaperMode}.
 *
 * <p>
 * The single point of extension when adding a window construction: add the
 * mode constant and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class TaperFactory {

    private TaperFactory() {
        // utility class, not instantiable
    }

    /**
     * @param mode  window construction; must not be {@code null}
     * @param alpha taper fraction in {@code [0, 1]}
     * @return the matching window
     * @throws NullPointerException     if {@code mode} is {@code null}
     * @throws IllegalArgumentException if {@code alpha} is out of range
     */
    public static TaperWindow create(TaperMode mode, double alpha) {
        Objects.requireNonNull(mode, "Taper mode must not be null");
        return switch (mode) {
            case HANNING_SPLIT -> new HanningSplitWindow(alpha);
            case TUKEY -> new TukeyWindow(alpha);
        };
    }
}
