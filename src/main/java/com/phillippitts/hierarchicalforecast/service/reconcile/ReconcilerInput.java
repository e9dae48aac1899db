package com.phillippitts.hierarchicalforecast.service.reconcile;

/**
 * Optional inputs a reconciler may declare. The point forecast is always supplied and is not
 * part of this vocabulary.
 */
public enum ReconcilerInput {
    /** In-sample fitted values of the model, or an explicit absence marker. */
    FITTED_VALUES,
    /** Requested confidence levels. */
    LEVELS,
    /** Gaussian scale recovered from a provided prediction interval. */
    SIGMA,
    /** Bootstrap sample paths. */
    BOOTSTRAP_SAMPLES,
    /** Flag telling the reconciler that bootstrap intervals are active. */
    BOOTSTRAP,
    /** Tag label to row positions. */
    TAGS,
    /** Row positions of the bottom-level series. */
    BOTTOM_INDEX,
    /** Aggregation matrix restricted to the forecast series. */
    SUMMING_MATRIX,
    /** Historical observations, one row per forecast series. */
    INSAMPLE
}
