package com.phillippitts.hierarchicalforecast.service.reconcile.impl;

import com.phillippitts.hierarchicalforecast.service.bootstrap.BootstrapSamples;
import com.phillippitts.hierarchicalforecast.service.interval.GaussianScaleEstimator;
import com.phillippitts.hierarchicalforecast.service.reconcile.AbstractHierarchicalReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconcilerInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;
import org.apache.commons.math3.linear.DefaultRealMatrixChangingVisitor;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.EnumSet;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Reconciles by summing bottom-level base forecasts through the aggregation matrix:
 * {@code mean = S * yHat[bottom]}.
 *
 * <p>Intervals, when levels are supplied:
 * <ul>
 *   <li><b>Gaussian:</b> bottom scales are aggregated assuming independent errors,
 *       {@code sigma_i = sqrt(sum_j S_ij * sigma_j^2)}, and bounds are {@code mean -/+ z(L) * sigma}</li>
 *   <li><b>Bootstrap:</b> every sample path is reconciled the same way and bounds are the
 *       empirical {@code (100 - L)/2} and {@code (100 + L)/2} percentiles per cell</li>
 * </ul>
 */
public final class BottomUpReconciler extends AbstractHierarchicalReconciler {

    public BottomUpReconciler() {
        super(EnumSet.of(ReconcilerInput.SUMMING_MATRIX, ReconcilerInput.BOTTOM_INDEX,
                ReconcilerInput.LEVELS, ReconcilerInput.SIGMA, ReconcilerInput.BOOTSTRAP_SAMPLES));
    }

    @Override
    protected String name() {
        return "BottomUp";
    }

    @Override
    protected ReconciliationResult doReconcile(ReconciliationInput input) {
        RealMatrix s = input.summingMatrix();
        int[] bottom = input.bottomIndex();
        RealMatrix mean = s.multiply(selectRows(input.forecast(), bottom));
        ReconciliationResult result = ReconciliationResult.meanOnly(mean);
        if (!input.isProvided(ReconcilerInput.LEVELS)) {
            return result;
        }
        List<Double> levels = input.levels();
        if (input.isProvided(ReconcilerInput.BOOTSTRAP_SAMPLES)) {
            return withBootstrapIntervals(result, s, bottom, input.bootstrapSamples(), levels);
        }
        if (input.isProvided(ReconcilerInput.SIGMA)) {
            return withGaussianIntervals(result, s, bottom, input.sigma(), levels);
        }
        throw new IllegalArgumentException("BottomUp needs sigma or bootstrap samples to build intervals");
    }

    private static ReconciliationResult withGaussianIntervals(ReconciliationResult result, RealMatrix s,
                                                              int[] bottom, RealMatrix sigma, List<Double> levels) {
        RealMatrix bottomVariance = selectRows(sigma, bottom);
        bottomVariance.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(int row, int column, double value) {
                return value * value;
            }
        });
        // S holds only 0/1 entries, so S squared element-wise is S
        RealMatrix sd = s.multiply(bottomVariance);
        sd.walkInOptimizedOrder(new DefaultRealMatrixChangingVisitor() {
            @Override
            public double visit(int row, int column, double value) {
                return Math.sqrt(value);
            }
        });
        ReconciliationResult out = result;
        for (double level : levels) {
            RealMatrix spread = sd.scalarMultiply(GaussianScaleEstimator.zScore(level));
            out = out.withInterval(level, result.mean().subtract(spread), result.mean().add(spread));
        }
        return out;
    }

    private static ReconciliationResult withBootstrapIntervals(ReconciliationResult result, RealMatrix s,
                                                               int[] bottom, BootstrapSamples samples,
                                                               List<Double> levels) {
        int rows = result.mean().getRowDimension();
        int cols = result.mean().getColumnDimension();
        // cells[i][t][k]: value of cell (i, t) in reconciled sample k
        double[][][] cells = new double[rows][cols][samples.size()];
        for (int k = 0; k < samples.size(); k++) {
            RealMatrix reconciled = s.multiply(selectRows(samples.path(k), bottom));
            for (int i = 0; i < rows; i++) {
                for (int t = 0; t < cols; t++) {
                    cells[i][t][k] = reconciled.getEntry(i, t);
                }
            }
        }
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        ReconciliationResult out = result;
        for (double level : levels) {
            double[][] lower = new double[rows][cols];
            double[][] upper = new double[rows][cols];
            for (int i = 0; i < rows; i++) {
                for (int t = 0; t < cols; t++) {
                    percentile.setData(cells[i][t]);
                    lower[i][t] = percentile.evaluate((100.0 - level) / 2.0);
                    upper[i][t] = percentile.evaluate((100.0 + level) / 2.0);
                }
            }
            out = out.withInterval(level, MatrixUtils.createRealMatrix(lower), MatrixUtils.createRealMatrix(upper));
        }
        return out;
    }

    static RealMatrix selectRows(RealMatrix matrix, int[] rows) {
        int[] columns = IntStream.range(0, matrix.getColumnDimension()).toArray();
        return matrix.getSubMatrix(rows, columns);
    }
}
