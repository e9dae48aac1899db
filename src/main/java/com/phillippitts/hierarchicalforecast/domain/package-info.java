/**
 * Tabular inputs and outputs of hierarchical reconciliation.
 *
 * <p>{@link com.phillippitts.hierarchicalforecast.domain.SeriesTable} is the long-format table
 * used for base forecasts, history and the reconciled output.
 * {@link com.phillippitts.hierarchicalforecast.domain.SummingMatrix} is the labelled aggregation
 * matrix and {@link com.phillippitts.hierarchicalforecast.domain.ReconciliationRequest} bundles
 * the inputs of one call.
 */
package com.phillippitts.hierarchicalforecast.domain;
