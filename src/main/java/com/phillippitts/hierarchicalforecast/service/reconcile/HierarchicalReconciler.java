package com.phillippitts.hierarchicalforecast.service.reconcile;

import java.util.Set;

/**
 * Strategy interface for making base forecasts coherent with the aggregation structure.
 *
 * <p>Each implementation declares up front which optional inputs it consumes
 * ({@link #capabilities()}); the dispatcher offers exactly those inputs, when available, and
 * nothing else. Capabilities and {@link #label()} are fixed at construction.
 *
 * <p><b>Output contract:</b> the result always carries a mean matrix shaped like the point
 * forecast. When {@link ReconcilerInput#LEVELS} was supplied, it also carries one lower and one
 * upper matrix per supplied level.
 *
 * <p><b>Thread Safety:</b> Implementations should be stateless apart from hyperparameters so one
 * instance can reconcile several models concurrently.
 *
 * @see AbstractHierarchicalReconciler
 */
public interface HierarchicalReconciler {

    /**
     * Canonical name plus serialized hyperparameters, e.g. {@code "TopDown_method-average_proportions"}.
     * Two instances with different hyperparameters must return different labels.
     *
     * @return stable label used in output column names
     */
    String label();

    /**
     * Optional inputs this reconciler consumes.
     *
     * @return declared capabilities (never null)
     */
    Set<ReconcilerInput> capabilities();

    /**
     * Reconciles one model's forecasts.
     *
     * @param input point forecast plus the declared inputs that were available
     * @return mean forecasts and, when levels were supplied, interval bounds
     */
    ReconciliationResult reconcile(ReconciliationInput input);

    default boolean usesFittedValues() {
        return capabilities().contains(ReconcilerInput.FITTED_VALUES);
    }

    default boolean usesLevels() {
        return capabilities().contains(ReconcilerInput.LEVELS);
    }

    default boolean usesBootstrap() {
        return capabilities().contains(ReconcilerInput.BOOTSTRAP_SAMPLES);
    }
}
