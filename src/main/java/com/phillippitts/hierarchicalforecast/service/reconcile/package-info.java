/**
 * Reconciliation method contract.
 *
 * <p>A {@link com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler}
 * declares its optional inputs statically through
 * {@link com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler#capabilities()},
 * receives an immutable
 * {@link com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationInput} per model and
 * returns a {@link com.phillippitts.hierarchicalforecast.service.reconcile.ReconciliationResult}.
 *
 * <p>Available methods:
 * <ul>
 *   <li>{@link com.phillippitts.hierarchicalforecast.service.reconcile.impl.BottomUpReconciler} -
 *       aggregates bottom-level forecasts, with Gaussian or bootstrap intervals</li>
 *   <li>{@link com.phillippitts.hierarchicalforecast.service.reconcile.impl.TopDownReconciler} -
 *       disaggregates the total forecast with historical proportions</li>
 * </ul>
 */
package com.phillippitts.hierarchicalforecast.service.reconcile;
