package com.polereduction.core.model;

import com.polereduction.core.exceptions.ValidationException;

import java.util.Arrays;
import java.util.Objects;

/**
 * A magnetic-anomaly profile: samples of the anomaly (nT) taken at ordered
 * positions along a survey line (m).
 *
 * <p>
 * Both sequences are copied on construction and on access, so a profile is
 * immutable once built and never aliases caller-owned arrays. The positions
 * are assumed to be uniformly spaced; the spacing itself is supplied to the
 * pipeline separately and is not checked against {@link #distance()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Profile {

    /** Smallest profile the pipeline accepts. */
    public static final int MIN_SAMPLES = 2;

    private final double[] distance;
    private final double[] anomaly;

    private Profile(double[] distance, double[] anomaly) {
        this.distance = distance;
        this.anomaly = anomaly;
    }

    /**
     * Build a profile from two equal-length sequences.
     *
     * @param distance positions along the line; must not be {@code null}
     * @param anomaly  anomaly values at those positions; must not be
     *                 {@code null}
     * @return a validated, immutable profile
     * @throws ValidationException if the lengths differ, fewer than
     *                             {@value #MIN_SAMPLES} samples are given,
     *                             or any sample is NaN or infinite
     */
    public static Profile of(double[] distance, double[] anomaly) {
        if (distance == null || anomaly == null) {
            throw new ValidationException("distance and anomaly sequences are required");
        }
        if (distance.length != anomaly.length) {
            throw new ValidationException("distance and anomaly must have equal length, got "
                    + distance.length + " and " + anomaly.length);
        }
        if (anomaly.length < MIN_SAMPLES) {
            throw new ValidationException("profile needs at least " + MIN_SAMPLES
                    + " samples, got " + anomaly.length);
        }
        requireFinite(distance, "distance");
        requireFinite(anomaly, "anomaly");
        return new Profile(distance.clone(), anomaly.clone());
    }

    private static void requireFinite(double[] values, String name) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new ValidationException(name + "[" + i + "] must be finite, got " + values[i]);
            }
        }
    }

    public int size() {
        return anomaly.length;
    }

    /** @return a copy of the sample positions */
    public double[] distance() {
        return distance.clone();
    }

    /** @return a copy of the anomaly values */
    public double[] anomaly() {
        return anomaly.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Profile that))
            return false;
        return Arrays.equals(distance, that.distance) && Arrays.equals(anomaly, that.anomaly);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(distance), Arrays.hashCode(anomaly));
    }

    @Override
    public String toString() {
        return "Profile{samples=" + anomaly.length
                + ", from=" + distance[0]
                + ", to=" + distance[distance.length - 1] + '}';
    }
}
