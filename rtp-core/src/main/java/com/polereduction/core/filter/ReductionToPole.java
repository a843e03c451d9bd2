package com.polereduction.core.filter;

import com.polereduction.core.config.ReductionSettings;
import com.polereduction.core.exceptions.NumericalInstabilityException;
import com.polereduction.core.exceptions.ValidationException;
import com.polereduction.core.model.FieldGeometry;
import com.polereduction.core.model.Profile;
import com.polereduction.core.model.Spectrum;
import com.polereduction.core.model.TaperMode;
import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * One-dimensional reduction to pole of a magnetic-anomaly profile.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   distance, anomaly
 *     → Detrender           (remove least-squares line)
 *     → Taper               (edge window)
 *     → SpectralTransformer (zero-pad, forward transform, wavenumbers)
 *     → OperatorBuilder     (transfer function from field geometry)
 *     → InverseTransformer  (multiply, inverse transform, truncate)
 *     → reduced anomaly
 * </pre>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and hold no per-call state, so one instance can
 * serve any number of concurrent calls. Caller arrays are never modified.
 * </p>
 *
 * <h3>Sign convention</h3>
 * <p>
 * The result is not negated. Callers that display the reduced anomaly
 * mirrored in amplitude apply {@link #mirror(double[])} afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReductionToPole {

    private static final Logger LOG = LoggerFactory.getLogger(ReductionToPole.class);

    private final Detrender detrender;
    private final Taper taper;
    private final SpectralTransformer spectralTransformer;
    private final OperatorBuilder operatorBuilder;
    private final InverseTransformer inverseTransformer;

    /**
     * @param settings pipeline settings; validated here
     * @throws NullPointerException  if {@code settings} is {@code null}
     * @throws IllegalStateException if the settings are invalid
     */
    public ReductionToPole(ReductionSettings settings) {
        Objects.requireNonNull(settings, "ReductionSettings must not be null");
        settings.validate();

        TaperMode mode = settings.resolveTaperMode();
        this.detrender = new Detrender();
        this.taper = new Taper(TaperFactory.create(mode, settings.getTaperAlpha()));
        this.spectralTransformer = new SpectralTransformer(settings.getPaddingFactor());
        this.operatorBuilder = new OperatorBuilder(settings.getDenominatorEpsilon());
        this.inverseTransformer = new InverseTransformer();
    }

    /**
     * @return a pipeline using {@link ReductionSettings#defaults()}
     */
    public static ReductionToPole withDefaults() {
        return new ReductionToPole(ReductionSettings.defaults());
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Reduce a profile to the pole.
     *
     * @param distance    sample positions along the line (m)
     * @param anomaly     anomaly values (nT), same length as {@code distance}
     * @param dx          sampling interval (m), {@code > 0}
     * @param inclination field inclination (degrees), within {@code [-90, 90]}
     * @param declination field declination (degrees)
     * @param azimuth     profile bearing from north (degrees)
     * @return the reduced anomaly, same length as the input
     * @throws ValidationException           if any input is malformed
     * @throws NumericalInstabilityException if the field geometry is
     *                                       degenerate
     */
    public double[] reduce(double[] distance, double[] anomaly, double dx,
            double inclination, double declination, double azimuth) {
        return reduce(Profile.of(distance, anomaly), dx,
                FieldGeometry.of(inclination, declination, azimuth));
    }

    /**
     * Reduce a profile to the pole.
     *
     * @param profile  the measured profile
     * @param dx       sampling interval (m), {@code > 0}
     * @param geometry field and profile directions
     * @return the reduced anomaly, {@code profile.size()} samples long
     * @throws ValidationException           if {@code dx} is not positive and
     *                                       finite or an argument is missing
     * @throws NumericalInstabilityException if the field geometry is
     *                                       degenerate
     */
    public double[] reduce(Profile profile, double dx, FieldGeometry geometry) {
        if (profile == null) {
            throw new ValidationException("profile is required");
        }
        if (geometry == null) {
            throw new ValidationException("field geometry is required");
        }
        if (!(dx > 0.0) || Double.isInfinite(dx)) {
            throw new ValidationException("sampling interval dx must be > 0, got " + dx);
        }

        double[] detrended = detrender.detrend(profile);
        double[] windowed = taper.apply(detrended);
        Spectrum spectrum = spectralTransformer.transform(windowed, dx);
        Complex[] operator = operatorBuilder.build(geometry, spectrum.wavenumbers());
        double[] reduced = inverseTransformer.apply(spectrum, operator);

        LOG.debug("Reduced {} with {} over {} bins", profile, geometry, spectrum.size());
        return reduced;
    }

    /**
     * Amplitude mirror of a reduced profile. Optional post-processing, not a
     * pipeline stage.
     *
     * @param values reduced anomaly; left untouched
     * @return a new array with every value negated
     */
    public static double[] mirror(double[] values) {
        Objects.requireNonNull(values, "Values must not be null");
        double[] mirrored = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mirrored[i] = -values[i];
        }
        return mirrored;
    }

    public TaperWindow getTaperWindow() {
        return taper.getWindow();
    }

    public int getPaddingFactor() {
        return spectralTransformer.getPaddingFactor();
    }

    public double getDenominatorEpsilon() {
        return operatorBuilder.getEpsilon();
    }
}
