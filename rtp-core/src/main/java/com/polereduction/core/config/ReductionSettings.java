package com.polereduction.core.config;

import com.polereduction.core.model.TaperMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tunable parameters of the reduction-to-pole pipeline.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * taperAlpha: 0.1
 * taperMode: hanning_split
 * paddingFactor: 2
 * denominatorEpsilon: 1.0e-12
 * </pre>
 *
 * <p>
 * Every property is optional; omitted ones keep their defaults. Call
 * {@link #validate()} after loading to verify the values.
 * </p>
 *
 * @since 1.0.0
 */
public class ReductionSettings {

    public static final double DEFAULT_TAPER_ALPHA = 0.1;
    public static final String DEFAULT_TAPER_MODE = "hanning_split";
    public static final int DEFAULT_PADDING_FACTOR = 2;
    public static final double DEFAULT_DENOMINATOR_EPSILON = 1e-12;

    /** Fraction of the profile, split across both ends, that is tapered. */
    private double taperAlpha = DEFAULT_TAPER_ALPHA;

    /** Window construction, see {@link TaperMode}. */
    private String taperMode = DEFAULT_TAPER_MODE;

    /** Transform length is the next power of two of {@code paddingFactor * n}. */
    private int paddingFactor = DEFAULT_PADDING_FACTOR;

    /** Operator denominators smaller than this are degenerate. */
    private double denominatorEpsilon = DEFAULT_DENOMINATOR_EPSILON;

    /**
     * @return settings holding every default value
     */
    public static ReductionSettings defaults() {
        return new ReductionSettings();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every property, reporting all problems at once.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (!(taperAlpha >= 0.0 && taperAlpha <= 1.0)) {
            errors.add("'taperAlpha' must be within [0, 1], got " + taperAlpha);
        }
        try {
            TaperMode.fromName(taperMode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (paddingFactor < 1) {
            errors.add("'paddingFactor' must be >= 1, got " + paddingFactor);
        }
        if (!(denominatorEpsilon > 0.0) || Double.isInfinite(denominatorEpsilon)) {
            errors.add("'denominatorEpsilon' must be a positive finite number, got " + denominatorEpsilon);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ReductionSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the configured window construction
     * @throws IllegalArgumentException if the configured name is unknown
     */
    public TaperMode resolveTaperMode() {
        return TaperMode.fromName(taperMode);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getTaperAlpha() {
        return taperAlpha;
    }

    public void setTaperAlpha(double taperAlpha) {
        this.taperAlpha = taperAlpha;
    }

    public String getTaperMode() {
        return taperMode;
    }

    /**
     * Set the window construction name, normalised to lowercase.
     *
     * @param taperMode mode name
     */
    public void setTaperMode(String taperMode) {
        this.taperMode = taperMode != null ? taperMode.toLowerCase(Locale.ROOT) : null;
    }

    public int getPaddingFactor() {
        return paddingFactor;
    }

    public void setPaddingFactor(int paddingFactor) {
        this.paddingFactor = paddingFactor;
    }

    public double getDenominatorEpsilon() {
        return denominatorEpsilon;
    }

    public void setDenominatorEpsilon(double denominatorEpsilon) {
        this.denominatorEpsilon = denominatorEpsilon;
    }

    @Override
    public String toString() {
        return "ReductionSettings{" +
                "taperAlpha=" + taperAlpha +
                ", taperMode='" + taperMode + '\'' +
                ", paddingFactor=" + paddingFactor +
                ", denominatorEpsilon=" + denominatorEpsilon +
                '}';
    }
}
