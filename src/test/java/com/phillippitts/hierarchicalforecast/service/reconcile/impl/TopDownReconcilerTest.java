package com.phillippitts.hierarchicalforecast.service.reconcile.impl;

import com.phillippitts.hierarchicalforecast.service.reconcile.ReconcilerInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TopDownReconcilerTest {

    // rows: total, A, B
    private static final RealMatrix S = MatrixUtils.createRealMatrix(new double[][]{{1, 1}, {1, 0}, {0, 1}});
    private static final int[] BOTTOM = {1, 2};
    private static final RealMatrix HISTORY = MatrixUtils.createRealMatrix(new double[][]{
            {2, 4, Double.NaN}, {1, 3, 5}, {1, 1, 1}});
    private static final RealMatrix FORECAST = MatrixUtils.createRealMatrix(new double[][]{
            {10, 20}, {0, 0}, {0, 0}});

    @Test
    void labelCarriesMethod() {
        assertThat(new TopDownReconciler(TopDownReconciler.Method.AVERAGE_PROPORTIONS).label())
                .isEqualTo("TopDown_method-average_proportions");
        assertThat(new TopDownReconciler(TopDownReconciler.Method.PROPORTION_AVERAGES).label())
                .isEqualTo("TopDown_method-proportion_averages");
    }

    @Test
    void declaresNoIntervalInputs() {
        TopDownReconciler reconciler = new TopDownReconciler(TopDownReconciler.Method.AVERAGE_PROPORTIONS);

        assertThat(reconciler.capabilities()).containsExactlyInAnyOrder(
                ReconcilerInput.SUMMING_MATRIX, ReconcilerInput.BOTTOM_INDEX, ReconcilerInput.INSAMPLE);
        assertThat(reconciler.usesLevels()).isFalse();
    }

    @Test
    void averageProportionsSplitTotal() {
        // A: (1/2 + 3/4) / 2 = 0.625, B: (1/2 + 1/4) / 2 = 0.375; the NaN period is skipped
        ReconciliationResult result = reconcile(TopDownReconciler.Method.AVERAGE_PROPORTIONS);

        assertThat(result.mean().getEntry(1, 0)).isCloseTo(6.25, within(1e-9));
        assertThat(result.mean().getEntry(2, 0)).isCloseTo(3.75, within(1e-9));
        assertThat(result.mean().getEntry(0, 1)).isCloseTo(20.0, within(1e-9));
        assertThat(result.intervals()).isEmpty();
    }

    @Test
    void proportionAveragesSplitTotal() {
        // A: mean(1, 3) / mean(2, 4) = 2/3, B: 1/3
        ReconciliationResult result = reconcile(TopDownReconciler.Method.PROPORTION_AVERAGES);

        assertThat(result.mean().getEntry(1, 0)).isCloseTo(20.0 / 3.0, within(1e-9));
        assertThat(result.mean().getEntry(2, 1)).isCloseTo(20.0 / 3.0, within(1e-9));
        assertThat(result.mean().getEntry(0, 0)).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void rejectsHierarchyWithoutTotalRow() {
        RealMatrix noTotal = MatrixUtils.createRealMatrix(new double[][]{{1, 0}, {0, 1}});
        ReconciliationInput input = ReconciliationInput.builder(MatrixUtils.createRealMatrix(2, 2))
                .summingMatrix(noTotal)
                .bottomIndex(new int[]{0, 1})
                .insample(MatrixUtils.createRealMatrix(2, 3))
                .buildFor(new TopDownReconciler(TopDownReconciler.Method.AVERAGE_PROPORTIONS).capabilities());

        assertThatThrownBy(() -> new TopDownReconciler(TopDownReconciler.Method.AVERAGE_PROPORTIONS)
                .reconcile(input))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("no total row");
    }

    @Test
    void rejectsNullMethod() {
        assertThatThrownBy(() -> new TopDownReconciler(null))
                .isInstanceOf(NullPointerException.class);
    }

    private static ReconciliationResult reconcile(TopDownReconciler.Method method) {
        TopDownReconciler reconciler = new TopDownReconciler(method);
        ReconciliationInput input = ReconciliationInput.builder(FORECAST)
                .summingMatrix(S)
                .bottomIndex(BOTTOM)
                .insample(HISTORY)
                .buildFor(reconciler.capabilities());
        return reconciler.reconcile(input);
    }
}
