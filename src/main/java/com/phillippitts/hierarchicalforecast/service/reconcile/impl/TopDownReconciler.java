package com.phillippitts.hierarchicalforecast.service.reconcile.impl;

import com.phillippitts.hierarchicalforecast.service.reconcile.AbstractHierarchicalReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconcilerInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciles by splitting the total forecast among bottom series with historical proportions.
 *
 * <p>The total is the row of S whose entries are all 1. Bottom forecasts are
 * {@code p_j * yHat[total]} and the result is {@code S * bottomForecasts}. Produces means only.
 *
 * <ul>
 *   <li>{@link Method#AVERAGE_PROPORTIONS}: {@code p_j = mean_t(y_j,t / y_total,t)}</li>
 *   <li>{@link Method#PROPORTION_AVERAGES}: {@code p_j = mean_t(y_j,t) / mean_t(y_total,t)}</li>
 * </ul>
 * Periods where either value is missing (NaN) are skipped; average proportions also skip periods
 * with a zero total.
 */
public final class TopDownReconciler extends AbstractHierarchicalReconciler {

    public enum Method {
        AVERAGE_PROPORTIONS("average_proportions"),
        PROPORTION_AVERAGES("proportion_averages");

        private final String key;

        Method(String key) {
            this.key = key;
        }

        @Override
        public String toString() {
            return key;
        }
    }

    private final Method method;

    /**
     * Creates a top-down reconciler.
     *
     * @param method how historical proportions are computed
     * @throws NullPointerException if method is null
     */
    public TopDownReconciler(Method method) {
        super(EnumSet.of(ReconcilerInput.SUMMING_MATRIX, ReconcilerInput.BOTTOM_INDEX, ReconcilerInput.INSAMPLE));
        this.method = Objects.requireNonNull(method, "method must not be null");
    }

    @Override
    protected String name() {
        return "TopDown";
    }

    @Override
    protected Map<String, Object> hyperparameters() {
        return Map.of("method", method);
    }

    @Override
    protected ReconciliationResult doReconcile(ReconciliationInput input) {
        RealMatrix s = input.summingMatrix();
        int[] bottom = input.bottomIndex();
        RealMatrix insample = input.insample();
        RealMatrix forecast = input.forecast();

        int total = totalRow(s);
        double[] totalHistory = insample.getRow(total);
        double[] totalForecast = forecast.getRow(total);
        double[][] bottomForecast = new double[bottom.length][totalForecast.length];
        for (int j = 0; j < bottom.length; j++) {
            double p = proportion(insample.getRow(bottom[j]), totalHistory);
            for (int t = 0; t < totalForecast.length; t++) {
                bottomForecast[j][t] = p * totalForecast[t];
            }
        }
        return ReconciliationResult.meanOnly(s.multiply(MatrixUtils.createRealMatrix(bottomForecast)));
    }

    private double proportion(double[] series, double[] total) {
        double sum = 0.0;
        double seriesSum = 0.0;
        double totalSum = 0.0;
        int n = 0;
        for (int t = 0; t < series.length; t++) {
            if (Double.isNaN(series[t]) || Double.isNaN(total[t])) {
                continue;
            }
            if (method == Method.AVERAGE_PROPORTIONS) {
                if (total[t] == 0.0) {
                    continue;
                }
                sum += series[t] / total[t];
            } else {
                seriesSum += series[t];
                totalSum += total[t];
            }
            n++;
        }
        if (n == 0) {
            throw new IllegalArgumentException("No usable history to compute " + method + " proportions");
        }
        if (method == Method.AVERAGE_PROPORTIONS) {
            return sum / n;
        }
        if (totalSum == 0.0) {
            throw new IllegalArgumentException("Total history sums to zero; proportions are undefined");
        }
        return (seriesSum / n) / (totalSum / n);
    }

    private static int totalRow(RealMatrix s) {
        for (int i = 0; i < s.getRowDimension(); i++) {
            boolean allOnes = true;
            for (int j = 0; j < s.getColumnDimension() && allOnes; j++) {
                allOnes = s.getEntry(i, j) == 1.0;
            }
            if (allOnes) {
                return i;
            }
        }
        throw new IllegalArgumentException("Aggregation matrix has no total row (a row of all ones)");
    }
}
