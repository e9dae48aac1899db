/**
 * Reconciliation dispatcher.
 *
 * <p>{@link com.phillippitts.hierarchicalforecast.service.orchestration.DefaultHierarchicalReconciliationService}
 * builds the hierarchy context once, stages a per-task input bundle for every (reconciler, model) pair
 * according to each reconciler's declared capabilities, checks the returned matrices and appends the
 * reconciled columns to the base forecast table.
 */
package com.phillippitts.hierarchicalforecast.service.orchestration;
