package com.polereduction.core.model;

import com.polereduction.core.exceptions.ValidationException;

import java.util.Objects;

/**
 * Direction of the inducing geomagnetic field together with the bearing of
 * the survey profile. All angles are in degrees.
 *
 * <p>
 * Declination and azimuth are conventionally in {@code [0, 360)} but only
 * need to be finite; inclination must lie in {@code [-90, 90]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldGeometry {

    public static final double MIN_INCLINATION = -90.0;
    public static final double MAX_INCLINATION = 90.0;

    private final double inclination;
    private final double declination;
    private final double azimuth;

    private FieldGeometry(double inclination, double declination, double azimuth) {
        this.inclination = inclination;
        this.declination = declination;
        this.azimuth = azimuth;
    }

    /**
     * @param inclination field inclination from horizontal, degrees
     * @param declination field declination from geographic north, degrees
     * @param azimuth     profile bearing from north, degrees
     * @return a validated geometry
     * @throws ValidationException if inclination is outside {@code [-90, 90]}
     *                             or any angle is not finite
     */
    public static FieldGeometry of(double inclination, double declination, double azimuth) {
        if (!Double.isFinite(inclination)
                || inclination < MIN_INCLINATION || inclination > MAX_INCLINATION) {
            throw new ValidationException("inclination must be within [-90, 90] degrees, got " + inclination);
        }
        if (!Double.isFinite(declination)) {
            throw new ValidationException("declination must be finite, got " + declination);
        }
        if (!Double.isFinite(azimuth)) {
            throw new ValidationException("azimuth must be finite, got " + azimuth);
        }
        return new FieldGeometry(inclination, declination, azimuth);
    }

    public double getInclination() {
        return inclination;
    }

    public double getDeclination() {
        return declination;
    }

    public double getAzimuth() {
        return azimuth;
    }

    // ---------------------------------------------------------------
    // Direction cosines
    // ---------------------------------------------------------------

    /** @return north component of the unit field vector, {@code cos(I)·cos(D)} */
    public double fieldX() {
        return Math.cos(Math.toRadians(inclination)) * Math.cos(Math.toRadians(declination));
    }

    /** @return east component of the unit field vector, {@code cos(I)·sin(D)} */
    public double fieldY() {
        return Math.cos(Math.toRadians(inclination)) * Math.sin(Math.toRadians(declination));
    }

    /** @return vertical component of the unit field vector, {@code sin(I)} */
    public double fieldZ() {
        return Math.sin(Math.toRadians(inclination));
    }

    /** @return north direction cosine of the profile, {@code cos(azimuth)} */
    public double profileX() {
        return Math.cos(Math.toRadians(azimuth));
    }

    /** @return east direction cosine of the profile, {@code sin(azimuth)} */
    public double profileY() {
        return Math.sin(Math.toRadians(azimuth));
    }

    /**
     * Projection of the horizontal field component onto the profile
     * direction, {@code Fx·kx + Fy·ky}. The real part of every operator
     * denominator.
     *
     * @return horizontal projection along the profile
     */
    public double horizontalProjection() {
        return fieldX() * profileX() + fieldY() * profileY();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldGeometry that))
            return false;
        return Double.compare(inclination, that.inclination) == 0
                && Double.compare(declination, that.declination) == 0
                && Double.compare(azimuth, that.azimuth) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(inclination, declination, azimuth);
    }

    @Override
    public String toString() {
        return "FieldGeometry{" +
                "inclination=" + inclination +
                ", declination=" + declination +
                ", azimuth=" + azimuth +
                '}';
    }
}
