package com.phillippitts.hierarchicalforecast.service.orchestration;

import com.phillippitts.hierarchicalforecast.domain.ReconciliationRequest;
import com.phillippitts.hierarchicalforecast.domain.SeriesTable;

import java.util.List;

/**
 * Applies every configured reconciler to every model of a base forecast table.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * HierarchicalReconciliationService service = ...;
 * SeriesTable reconciled = service.reconcile(ReconciliationRequest.builder()
 *         .forecasts(baseForecasts)
 *         .history(history)
 *         .summingMatrix(s)
 *         .tags(tags)
 *         .levels(80, 95)
 *         .build());
 * double[] mean = reconciled.column("naive/BottomUp");
 * double[] lo80 = reconciled.column("naive/BottomUp-lo-80");
 * }</pre>
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe; calls share no mutable state.
 *
 * @see com.phillippitts.hierarchicalforecast.service.reconcile.HierarchicalReconciler
 */
public interface HierarchicalReconciliationService {

    /**
     * Reconciles all models with all reconcilers.
     *
     * <p>The returned table keeps every row and column of the base forecasts, in their original
     * order, and appends one mean column per (model, reconciler) plus a lower/upper pair per
     * level whenever intervals were produced.
     *
     * @param request reconciliation inputs
     * @return base forecasts augmented with reconciled columns
     * @throws com.phillippitts.hierarchicalforecast.exception.HierarchyMismatchException if series
     *         and aggregation matrix disagree
     * @throws com.phillippitts.hierarchicalforecast.exception.RaggedHorizonException if forecast
     *         series do not share one horizon
     * @throws com.phillippitts.hierarchicalforecast.exception.ReconcilerContractException if a
     *         reconciler omits a required output
     */
    SeriesTable reconcile(ReconciliationRequest request);

    /**
     * Labels of the configured reconcilers, in invocation order.
     *
     * @return reconciler labels
     */
    List<String> labels();
}
