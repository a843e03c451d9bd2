package com.polereduction.core.filter;

import com.polereduction.core.exceptions.ValidationException;
import com.polereduction.core.model.Profile;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Removes the least-squares linear trend {@code a·distance + b} from an
 * anomaly sequence.
 *
 * <p>
 * A leftover drift puts spurious energy next to zero wavenumber and leaves a
 * step at the wrap-around boundary of the transform.
 * </p>
 *
 * @since 1.0.0
 */
public final class Detrender {

    /**
     * @param distance sample positions
     * @param anomaly  anomaly values
     * @return a new array of residuals {@code anomaly[i] - (a·distance[i] + b)}
     * @throws ValidationException if the lengths differ or fewer than two
     *                             samples are given
     */
    public double[] detrend(double[] distance, double[] anomaly) {
        if (distance == null || anomaly == null) {
            throw new ValidationException("distance and anomaly sequences are required");
        }
        if (distance.length != anomaly.length) {
            throw new ValidationException("distance and anomaly must have equal length, got "
                    + distance.length + " and " + anomaly.length);
        }
        if (anomaly.length < Profile.MIN_SAMPLES) {
            throw new ValidationException("detrending needs at least " + Profile.MIN_SAMPLES
                    + " samples, got " + anomaly.length);
        }

        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < anomaly.length; i++) {
            regression.addData(distance[i], anomaly[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        if (Double.isNaN(slope)) {
            // every position identical: no slope to fit, remove the mean only
            slope = 0.0;
            intercept = mean(anomaly);
        }

        double[] residuals = new double[anomaly.length];
        for (int i = 0; i < anomaly.length; i++) {
            residuals[i] = anomaly[i] - (slope * distance[i] + intercept);
        }
        return residuals;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * @param profile profile to detrend
     * @return residuals after removing the linear trend
     */
    public double[] detrend(Profile profile) {
        return detrend(profile.distance(), profile.anomaly());
    }
}
