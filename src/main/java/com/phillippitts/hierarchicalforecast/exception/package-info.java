/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.hierarchicalforecast.exception.HierarchicalForecastException}:
 * <ul>
 *   <li>{@link com.phillippitts.hierarchicalforecast.exception.HierarchyMismatchException} - series
 *       missing from the aggregation matrix</li>
 *   <li>{@link com.phillippitts.hierarchicalforecast.exception.RaggedHorizonException} - series
 *       that do not share one horizon</li>
 *   <li>{@link com.phillippitts.hierarchicalforecast.exception.InvalidConfidenceLevelException} -
 *       levels outside (0, 100)</li>
 *   <li>{@link com.phillippitts.hierarchicalforecast.exception.MissingHistoryException} - series
 *       without historical observations</li>
 *   <li>{@link com.phillippitts.hierarchicalforecast.exception.ReconcilerContractException} -
 *       reconcilers returning incomplete results</li>
 * </ul>
 *
 * <p>Structural input errors are fatal for the whole reconciliation call. Failures raised by a
 * reconciler itself are propagated unchanged.
 */
package com.phillippitts.hierarchicalforecast.exception;
