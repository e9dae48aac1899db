package com.phillippitts.hierarchicalforecast.service.bootstrap;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Block bootstrap over in-sample residuals.
 *
 * <p>Residuals are {@code insample - fitted}; time columns holding any NaN are dropped. Each path
 * adds one contiguous block of {@code h} residual columns, starting at a uniformly drawn offset,
 * to the point forecast. Blocks keep the cross-series correlation of the errors.
 *
 * <p>Every call starts from the configured seed, so identical inputs yield identical samples.
 */
public final class ResidualBootstrapSampler implements BootstrapSampler {
    private static final Logger LOG = LogManager.getLogger(ResidualBootstrapSampler.class);

    private final long seed;

    public ResidualBootstrapSampler(long seed) {
        this.seed = seed;
    }

    public ResidualBootstrapSampler() {
        this(0L);
    }

    @Override
    public BootstrapSamples sample(RealMatrix insample, RealMatrix fitted, RealMatrix pointForecast, int sampleCount) {
        Objects.requireNonNull(insample, "insample must not be null");
        Objects.requireNonNull(fitted, "fitted must not be null");
        Objects.requireNonNull(pointForecast, "pointForecast must not be null");
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1, got " + sampleCount);
        }
        if (insample.getRowDimension() != fitted.getRowDimension()
                || insample.getColumnDimension() != fitted.getColumnDimension()) {
            throw new IllegalArgumentException("insample and fitted differ in shape");
        }
        if (insample.getRowDimension() != pointForecast.getRowDimension()) {
            throw new IllegalArgumentException("insample and pointForecast differ in series count");
        }

        double[][] residuals = completeResidualColumns(insample, fitted);
        int usable = residuals.length;
        int h = pointForecast.getColumnDimension();
        if (usable <= h) {
            throw new IllegalArgumentException("Bootstrap needs more than " + h
                    + " complete residual periods, found " + usable);
        }
        LOG.debug("Drawing {} bootstrap paths from {} residual periods (h={})", sampleCount, usable, h);

        SplittableRandom random = new SplittableRandom(seed);
        int series = pointForecast.getRowDimension();
        List<RealMatrix> paths = new ArrayList<>(sampleCount);
        for (int s = 0; s < sampleCount; s++) {
            int start = random.nextInt(usable - h);
            double[][] path = new double[series][h];
            for (int i = 0; i < series; i++) {
                for (int t = 0; t < h; t++) {
                    path[i][t] = pointForecast.getEntry(i, t) + residuals[start + t][i];
                }
            }
            paths.add(MatrixUtils.createRealMatrix(path));
        }
        return new BootstrapSamples(paths);
    }

    /** Residual columns without NaN, indexed [period][series]. */
    private static double[][] completeResidualColumns(RealMatrix insample, RealMatrix fitted) {
        List<double[]> columns = new ArrayList<>();
        for (int t = 0; t < insample.getColumnDimension(); t++) {
            double[] column = new double[insample.getRowDimension()];
            boolean complete = true;
            for (int i = 0; i < column.length && complete; i++) {
                column[i] = insample.getEntry(i, t) - fitted.getEntry(i, t);
                complete = !Double.isNaN(column[i]);
            }
            if (complete) {
                columns.add(column);
            }
        }
        return columns.toArray(new double[0][]);
    }
}
