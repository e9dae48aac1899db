package com.phillippitts.hierarchicalforecast.service.interval;

import com.phillippitts.hierarchicalforecast.domain.ConfidenceLevels;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.Objects;

/**
 * Recovers a Gaussian standard deviation from one prediction interval bound.
 *
 * <p>A symmetric Gaussian interval around the point forecast {@code p} at level {@code L} has
 * bounds {@code p -/+ z(L) * sigma}, with {@code z(L) = Phi^-1(0.5 + L/200)}. One bound and its
 * level therefore determine {@code sigma = sign * (bound - p) / z(L)}, where {@code sign} is -1
 * for a lower bound and +1 for an upper bound, so a well-formed interval yields a positive scale.
 */
public final class GaussianScaleEstimator {

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private GaussianScaleEstimator() {
        // Utility class - prevent instantiation
    }

    /**
     * One-sided standard-normal quantile of a central interval.
     *
     * @param level confidence level in percent, in (0, 100)
     * @return {@code Phi^-1(0.5 + level/200)}
     * @throws com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException
     *         if level is outside (0, 100)
     */
    public static double zScore(double level) {
        ConfidenceLevels.requireValid(level);
        return STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200.0);
    }

    /**
     * Estimates the scale of every series/time cell.
     *
     * @param pointForecast series x horizon point forecasts
     * @param bound series x horizon interval bound on one side
     * @param side side of {@code bound}
     * @param level level of {@code bound} in percent
     * @return series x horizon scale estimates
     * @throws IllegalArgumentException if the matrices differ in shape
     */
    public static RealMatrix estimate(RealMatrix pointForecast, RealMatrix bound, BoundSide side, double level) {
        Objects.requireNonNull(pointForecast, "pointForecast must not be null");
        Objects.requireNonNull(bound, "bound must not be null");
        Objects.requireNonNull(side, "side must not be null");
        if (pointForecast.getRowDimension() != bound.getRowDimension()
                || pointForecast.getColumnDimension() != bound.getColumnDimension()) {
            throw new IllegalArgumentException("bound shape " + bound.getRowDimension() + "x"
                    + bound.getColumnDimension() + " does not match forecast shape "
                    + pointForecast.getRowDimension() + "x" + pointForecast.getColumnDimension());
        }
        double z = zScore(level);
        return bound.subtract(pointForecast).scalarMultiply(side.sign() / z);
    }
}
