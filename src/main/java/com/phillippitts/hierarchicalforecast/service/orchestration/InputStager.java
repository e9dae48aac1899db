package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.service.bootstrap.BootstrapSampler;
import com.phillippitts.hierarchicalforecast.service.context.HierarchyContext;
import com.phillippitts.hierarchicalforecast.service.interval.GaussianScaleEstimator;
import com.phillippitts.hierarchicalforecast.service.interval.IntervalColumns.IntervalColumn;
import com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconcilerInput;
import com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a fresh {@link ReconciliationInput} for each (reconciler, model) task.
 *
 * <p>Staging rules:
 * <ul>
 *   <li>context inputs (S, bottom positions, tags, history) are staged when declared, so
 *       undeclared matrices are never copied</li>
 *   <li>the model has intervals, the reconciler uses levels, levels were requested and bootstrap
 *       is off: a Gaussian scale is recovered from one interval column and staged with the levels</li>
 *   <li>the reconciler uses fitted values, or bootstrap is on: the model's in-sample column is
 *       looked up in the history. If present it is staged (when declared) and, in bootstrap mode for
 *       a reconciler using levels and samples, bootstrap samples and the levels are staged too. If
 *       absent, an explicit "unavailable" marker is staged instead</li>
 * </ul>
 * The bundle handed to the reconciler keeps only the staged inputs it declared. Nothing is
 * shared between tasks, so tasks may run concurrently.
 */
final class InputStager {
    private static final Logger LOG = LogManager.getLogger(InputStager.class);

    /** Relative tolerance when comparing the scales implied by both bounds of one level. */
    static final double SYMMETRY_TOLERANCE = 1e-6;

    private final BootstrapSampler sampler;
    private final int bootstrapSamples;

    InputStager(BootstrapSampler sampler, int bootstrapSamples) {
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        if (bootstrapSamples < 1) {
            throw new IllegalArgumentException("bootstrapSamples must be >= 1, got " + bootstrapSamples);
        }
        this.bootstrapSamples = bootstrapSamples;
    }

    ReconciliationInput stage(HierarchicalReconciler reconciler, ModelSlice slice, HierarchyContext context,
                              List<Double> levels, boolean bootstrap) {
        ReconciliationInput.Builder builder = ReconciliationInput.builder(slice.forecast());
        stageContext(builder, reconciler.capabilities(), context);
        boolean levelsRequested = !levels.isEmpty();

        if (slice.hasIntervals() && reconciler.usesLevels() && levelsRequested && !bootstrap) {
            builder.sigma(recoverScale(slice)).levels(levels);
        }

        if (reconciler.usesFittedValues() || bootstrap) {
            boolean wantsSamples = bootstrap && levelsRequested
                    && reconciler.usesLevels() && reconciler.usesBootstrap();
            Optional<RealMatrix> fitted = slice.fitted();
            if (fitted.isPresent()) {
                builder.fittedValues(fitted.get());
                if (wantsSamples) {
                    builder.bootstrapSamples(sampler.sample(context.insample(), fitted.get(),
                            slice.forecast(), bootstrapSamples)).levels(levels);
                }
            } else {
                builder.fittedValuesUnavailable();
                if (wantsSamples) {
                    LOG.warn("Model {} has no in-sample column; {} returns means only", slice.model(),
                            reconciler.label());
                }
            }
        }
        return builder.buildFor(reconciler.capabilities());
    }

    private static void stageContext(ReconciliationInput.Builder builder, Set<ReconcilerInput> capabilities,
                                     HierarchyContext context) {
        if (capabilities.contains(ReconcilerInput.SUMMING_MATRIX)) {
            builder.summingMatrix(context.summingMatrix());
        }
        if (capabilities.contains(ReconcilerInput.BOTTOM_INDEX)) {
            builder.bottomIndex(context.bottomIndex());
        }
        if (capabilities.contains(ReconcilerInput.TAGS)) {
            builder.tags(context.tagIndex());
        }
        if (capabilities.contains(ReconcilerInput.INSAMPLE)) {
            builder.insample(context.insample());
        }
    }

    /**
     * Recovers sigma from the first interval column of the model. When the opposite bound of the
     * same level is present and implies a different scale, the asymmetry is logged.
     */
    private static RealMatrix recoverScale(ModelSlice slice) {
        IntervalColumn chosen = slice.intervals().get(0);
        RealMatrix sigma = GaussianScaleEstimator.estimate(slice.forecast(), slice.bound(chosen),
                chosen.side(), chosen.level());
        slice.partnerOf(chosen).ifPresent(partner -> {
            RealMatrix other = GaussianScaleEstimator.estimate(slice.forecast(), slice.bound(partner),
                    partner.side(), partner.level());
            double gap = maxRelativeGap(sigma, other);
            if (gap > SYMMETRY_TOLERANCE) {
                LOG.warn("Asymmetric interval for model {} at level {}: {} and {} imply scales differing by {}; "
                        + "using {}", slice.model(), chosen.level(), chosen.columnName(), partner.columnName(),
                        gap, chosen.columnName());
            }
        });
        return sigma;
    }

    static double maxRelativeGap(RealMatrix a, RealMatrix b) {
        double worst = 0.0;
        for (int i = 0; i < a.getRowDimension(); i++) {
            for (int t = 0; t < a.getColumnDimension(); t++) {
                double x = a.getEntry(i, t);
                double y = b.getEntry(i, t);
                if (Double.isNaN(x) || Double.isNaN(y)) {
                    continue;
                }
                double scale = Math.max(1.0, Math.max(Math.abs(x), Math.abs(y)));
                worst = Math.max(worst, Math.abs(x - y) / scale);
            }
        }
        return worst;
    }
}
