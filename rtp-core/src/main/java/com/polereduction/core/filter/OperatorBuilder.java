package com.polereduction.core.filter;

import com.polereduction.core.exceptions.NumericalInstabilityException;
import com.polereduction.core.model.FieldGeometry;
import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Builds the per-wavenumber reduction-to-pole transfer function.
 *
 * <p>
 * For a wavenumber vector lying along the profile azimuth the operator is
 * </p>
 *
 * <pre>
 *   k = 0 :  1
 *   k ≠ 0 :  Fz / (Fx·kx + Fy·ky + i·Fz·sign(k))
 * </pre>
 *
 * <p>
 * where {@code (Fx, Fy, Fz)} is the unit field vector and {@code (kx, ky)}
 * the profile direction. Since the field vector has unit length,
 * {@code |operator| <= 1}, with equality exactly when the horizontal field
 * is perpendicular to the profile.
 * </p>
 *
 * <h3>Degenerate geometry</h3>
 * <p>
 * A horizontal field perpendicular to the profile makes every denominator
 * vanish. Any denominator whose magnitude is below the configured epsilon
 * fails the whole call with {@link NumericalInstabilityException}; no entry is
 * ever silently zeroed.
 * </p>
 *
 * @since 1.0.0
 */
public final class OperatorBuilder {

    private final double epsilon;

    /**
     * @param epsilon smallest acceptable denominator magnitude
     * @throws IllegalArgumentException if {@code epsilon} is not positive and
     *                                  finite
     */
    public OperatorBuilder(double epsilon) {
        if (!(epsilon > 0.0) || Double.isInfinite(epsilon)) {
            throw new IllegalArgumentException("Denominator epsilon must be > 0, got: " + epsilon);
        }
        this.epsilon = epsilon;
    }

    /**
     * @param geometry    field and profile directions
     * @param wavenumbers angular wavenumbers in rad/m
     * @return a new operator array, one entry per wavenumber
     * @throws NumericalInstabilityException if any denominator is degenerate
     */
    public Complex[] build(FieldGeometry geometry, double[] wavenumbers) {
        Objects.requireNonNull(geometry, "Field geometry must not be null");
        Objects.requireNonNull(wavenumbers, "Wavenumbers must not be null");

        double horizontal = geometry.horizontalProjection();
        double vertical = geometry.fieldZ();
        Complex numerator = new Complex(vertical, 0.0);

        Complex[] operator = new Complex[wavenumbers.length];
        for (int i = 0; i < wavenumbers.length; i++) {
            double k = wavenumbers[i];
            if (k == 0.0) {
                operator[i] = Complex.ONE;
                continue;
            }
            Complex denominator = new Complex(horizontal, vertical * Math.signum(k));
            double magnitude = denominator.abs();
            if (!(magnitude >= epsilon)) {
                throw new NumericalInstabilityException(i, magnitude, epsilon);
            }
            operator[i] = numerator.divide(denominator);
        }
        return operator;
    }

    public double getEpsilon() {
        return epsilon;
    }
}
